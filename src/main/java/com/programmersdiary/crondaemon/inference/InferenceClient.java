package com.programmersdiary.crondaemon.inference;

/**
 * Blocking call to the language model. Implementations need not enforce a timeout;
 * {@link InferenceService} does.
 */
public interface InferenceClient {

    String generate(InferenceRequest request);
}
