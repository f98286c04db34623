package com.programmersdiary.crondaemon.inference;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ModelConfig {

    private final String baseUrl;
    private final String name;
    private final String keepAlive;
    private final int contextLength;
    private final double temperature;
    private final long timeoutMs;
    private final boolean warmUp;

    public ModelConfig(
            @Value("${crondaemon.model.base-url:http://localhost:11434}") String baseUrl,
            @Value("${crondaemon.model.name:tinyllama}") String name,
            @Value("${crondaemon.model.keep-alive:-1m}") String keepAlive,
            @Value("${crondaemon.model.context-length:4096}") int contextLength,
            @Value("${crondaemon.model.temperature:0.7}") double temperature,
            @Value("${crondaemon.model.timeout-ms:120000}") long timeoutMs,
            @Value("${crondaemon.model.warm-up:true}") boolean warmUp) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("crondaemon.model.timeout-ms must be positive");
        }
        this.baseUrl = baseUrl;
        this.name = name;
        this.keepAlive = keepAlive;
        this.contextLength = contextLength;
        this.temperature = temperature;
        this.timeoutMs = timeoutMs;
        this.warmUp = warmUp;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String name() {
        return name;
    }

    public String keepAlive() {
        return keepAlive;
    }

    public int contextLength() {
        return contextLength;
    }

    public double temperature() {
        return temperature;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public boolean warmUp() {
        return warmUp;
    }
}
