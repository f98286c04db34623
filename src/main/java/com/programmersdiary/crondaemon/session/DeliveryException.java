package com.programmersdiary.crondaemon.session;

/**
 * Raised by a transport that could not deliver a message. Transient failures (rate limits, timeouts)
 * are worth one more attempt; permanent ones (blocked bot, closed stream) are not.
 */
public class DeliveryException extends Exception {

    private final boolean transientFailure;

    public DeliveryException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public DeliveryException(String message, boolean transientFailure) {
        this(message, transientFailure, null);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
