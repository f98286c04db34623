package com.programmersdiary.crondaemon.chat;

import java.util.List;

public final class ContextWindowTrimmer {

    private ContextWindowTrimmer() {
    }

    /**
     * Newest messages whose combined content fits in {@code charLimit}; older ones are dropped first.
     */
    public static List<ChatMessage> trimToLimit(List<ChatMessage> items, int charLimit) {
        if (items.isEmpty()) {
            return items;
        }
        if (charLimit <= 0) {
            return items.subList(items.size(), items.size());
        }
        int total = 0;
        int start = items.size();
        for (int i = items.size() - 1; i >= 0; i--) {
            String content = items.get(i).content();
            int len = content != null ? content.length() : 0;
            if (total + len > charLimit) {
                break;
            }
            total += len;
            start = i;
        }
        return items.subList(start, items.size());
    }

    public static List<ChatMessage> lastN(List<ChatMessage> items, int n) {
        return items.subList(Math.max(0, items.size() - n), items.size());
    }
}
