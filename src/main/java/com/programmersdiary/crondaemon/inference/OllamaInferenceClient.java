package com.programmersdiary.crondaemon.inference;

import com.programmersdiary.crondaemon.chat.ChatMessage;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

@Component
public class OllamaInferenceClient implements InferenceClient {

    private final ChatModel chatModel;

    public OllamaInferenceClient(ChatModelFactory chatModelFactory, ModelConfig modelConfig) {
        this.chatModel = chatModelFactory.create(modelConfig);
    }

    @Override
    public String generate(InferenceRequest request) {
        var options = OllamaChatOptions.builder()
                .model(request.model())
                .keepAlive(request.keepAlive())
                .build();
        try {
            var response = chatModel.call(new Prompt(toSpringMessages(request), options));
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new MalformedResponseException("Model returned no result");
            }
            var text = response.getResult().getOutput().getText();
            if (text == null || text.isBlank()) {
                throw new MalformedResponseException("Model returned an empty answer");
            }
            return text;
        } catch (RestClientException e) {
            throw new InferenceUnavailableException("Model endpoint unavailable: " + e.getMessage(), e);
        }
    }

    static List<Message> toSpringMessages(InferenceRequest request) {
        var messages = new ArrayList<Message>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        request.context().forEach(m -> messages.add(toSpringMessage(m)));
        messages.add(new UserMessage(request.prompt()));
        return messages;
    }

    private static Message toSpringMessage(ChatMessage message) {
        var content = message.content() != null ? message.content() : "";
        return switch (message.role()) {
            case "system" -> new SystemMessage(content);
            case "assistant" -> new AssistantMessage(content);
            default -> new UserMessage(content);
        };
    }
}
