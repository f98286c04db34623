package com.programmersdiary.crondaemon.chat;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ContextConfig {

    private final String systemInstructions;
    private final int charsLimit;
    private final int maxHistory;

    public ContextConfig(
            @Value("${crondaemon.system-instructions:}") String systemInstructions,
            @Value("${crondaemon.context-window.chars-limit:12000}") int charsLimit,
            @Value("${crondaemon.context-window.max-history:50}") int maxHistory) {
        this.systemInstructions = systemInstructions != null ? systemInstructions : "";
        this.charsLimit = charsLimit;
        this.maxHistory = Math.max(0, maxHistory);
    }

    public String systemInstructions() {
        return systemInstructions;
    }

    public int charsLimit() {
        return charsLimit;
    }

    public int maxHistory() {
        return maxHistory;
    }
}
