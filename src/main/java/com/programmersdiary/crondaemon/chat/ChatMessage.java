package com.programmersdiary.crondaemon.chat;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ChatMessage(String role, String content, long timestampMillis, String tag) {

    public static final String TAG_SCHEDULED = "scheduled";

    public static ChatMessage of(String role, String content) {
        return new ChatMessage(role, content, System.currentTimeMillis(), null);
    }

    public static ChatMessage scheduled(String content) {
        return new ChatMessage("assistant", content, System.currentTimeMillis(), TAG_SCHEDULED);
    }

    @JsonIgnore
    public boolean isScheduled() {
        return TAG_SCHEDULED.equals(tag);
    }
}
