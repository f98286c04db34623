package com.programmersdiary.crondaemon.inference;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class InferenceConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ThreadPoolExecutor inferencePool(
            @Value("${crondaemon.model.max-concurrent-calls:4}") int maxConcurrentCalls,
            @Value("${crondaemon.model.queue-capacity:16}") int queueCapacity) {
        return newInferencePool(maxConcurrentCalls, queueCapacity);
    }

    /**
     * A fixed set of daemon threads in front of a bounded queue. A model call that ignores its
     * interrupt keeps its thread, so the thread count can never grow past {@code maxConcurrentCalls}.
     */
    public static ThreadPoolExecutor newInferencePool(int maxConcurrentCalls, int queueCapacity) {
        int threads = Math.max(1, maxConcurrentCalls);
        var counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    var thread = new Thread(r, "inference-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
