package com.programmersdiary.crondaemon.chat;

import java.util.List;

/**
 * Append-only chat log for one lineage. {@code contextStart} is the index of the first message that
 * may still be sent to the model; {@code /clear} moves it to the end without touching the log.
 */
public record Conversation(String lineage, List<ChatMessage> messages, int contextStart) {

    public Conversation withContextStart(int contextStart) {
        return new Conversation(lineage, messages, contextStart);
    }
}
