package com.programmersdiary.crondaemon.inference;

public class InferenceUnavailableException extends InferenceException {

    public InferenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
