package com.programmersdiary.crondaemon.inference;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.stereotype.Component;

@Component
public class ChatModelFactory {

    public ChatModel create(ModelConfig config) {
        var api = OllamaApi.builder()
                .baseUrl(config.baseUrl() != null ? config.baseUrl() : "http://localhost:11434")
                .build();
        var options = OllamaChatOptions.builder()
                .model(config.name() != null ? config.name() : "tinyllama")
                .keepAlive(config.keepAlive())
                .numCtx(config.contextLength())
                .temperature(config.temperature())
                .build();
        return OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(options)
                .build();
    }
}
