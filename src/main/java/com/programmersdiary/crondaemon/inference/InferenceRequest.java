package com.programmersdiary.crondaemon.inference;

import com.programmersdiary.crondaemon.chat.ChatMessage;

import java.util.List;

public record InferenceRequest(String systemPrompt,
                               List<ChatMessage> context,
                               String prompt,
                               String model,
                               String keepAlive) {
}
