package com.programmersdiary.crondaemon.inference;

public class InferenceTimeoutException extends InferenceException {

    private final long timeoutMs;

    public InferenceTimeoutException(long timeoutMs) {
        super("Model did not answer within " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
