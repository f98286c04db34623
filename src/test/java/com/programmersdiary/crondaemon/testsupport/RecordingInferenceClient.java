package com.programmersdiary.crondaemon.testsupport;

import com.programmersdiary.crondaemon.inference.InferenceClient;
import com.programmersdiary.crondaemon.inference.InferenceRequest;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Records every request and answers with a configurable function; defaults to echoing the prompt.
 */
public class RecordingInferenceClient implements InferenceClient {

    private final List<InferenceRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Function<InferenceRequest, String> responder = request -> "Echo: " + request.prompt();

    public void respondWith(String reply) {
        responder = request -> reply;
    }

    public void respondWith(Function<InferenceRequest, String> responder) {
        this.responder = responder;
    }

    public List<InferenceRequest> requests() {
        return List.copyOf(requests);
    }

    public int callCount() {
        return requests.size();
    }

    @Override
    public String generate(InferenceRequest request) {
        requests.add(request);
        return responder.apply(request);
    }
}
