package com.programmersdiary.crondaemon.inference;

public class MalformedResponseException extends InferenceException {

    public MalformedResponseException(String message) {
        super(message);
    }
}
