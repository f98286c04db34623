package com.programmersdiary.crondaemon.inference;

import com.programmersdiary.crondaemon.chat.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Every model call in the daemon goes through here. Calls run on the bounded {@code inferencePool} so
 * a caller waits at most {@code crondaemon.model.timeout-ms}; a call that overruns is interrupted and
 * abandoned. When every pool thread is busy and the queue is full the call fails as unavailable.
 */
@Service
public class InferenceService {

    private static final Logger log = LoggerFactory.getLogger(InferenceService.class);

    private final InferenceClient client;
    private final ModelConfig modelConfig;
    private final ExecutorService calls;

    public InferenceService(InferenceClient client,
                            ModelConfig modelConfig,
                            @Qualifier("inferencePool") ExecutorService calls) {
        this.client = client;
        this.modelConfig = modelConfig;
        this.calls = calls;
    }

    public String generate(String systemPrompt, List<ChatMessage> context, String prompt) {
        var request = new InferenceRequest(systemPrompt, List.copyOf(context), prompt,
                modelConfig.name(), modelConfig.keepAlive());
        Future<String> future;
        try {
            future = calls.submit(() -> client.generate(request));
        } catch (RejectedExecutionException e) {
            throw new InferenceUnavailableException("Model is busy, too many calls in flight", e);
        }
        try {
            return future.get(modelConfig.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new InferenceTimeoutException(modelConfig.timeoutMs());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceUnavailableException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof InferenceException inferenceException) {
                throw inferenceException;
            }
            throw new InferenceUnavailableException("Model call failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Loads the model in the background. Runs on {@link ApplicationStartedEvent}, which is published
     * before any {@code CommandLineRunner} starts.
     */
    @EventListener(ApplicationStartedEvent.class)
    public void warmUp() {
        if (!modelConfig.warmUp()) {
            return;
        }
        var request = new InferenceRequest("", List.of(), "hi", modelConfig.name(), modelConfig.keepAlive());
        try {
            calls.execute(() -> {
                log.info("Warming up model '{}'", modelConfig.name());
                try {
                    client.generate(request);
                    log.info("Model '{}' is loaded", modelConfig.name());
                } catch (RuntimeException e) {
                    log.warn("Model warm-up failed: {}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Model warm-up skipped: {}", e.getMessage());
        }
    }

    public String modelName() {
        return modelConfig.name();
    }

    public String host() {
        return modelConfig.baseUrl();
    }
}
