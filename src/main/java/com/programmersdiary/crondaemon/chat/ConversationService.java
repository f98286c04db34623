package com.programmersdiary.crondaemon.chat;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation memory keyed by lineage. Writes to one lineage are serialized; different lineages
 * proceed independently.
 */
@Service
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final ContextConfig contextConfig;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public ConversationService(ConversationRepository conversationRepository, ContextConfig contextConfig) {
        this.conversationRepository = conversationRepository;
        this.contextConfig = contextConfig;
    }

    public void append(String lineage, ChatMessage message) {
        synchronized (lockFor(lineage)) {
            var conversation = getOrCreate(lineage);
            var messages = new ArrayList<>(conversation.messages());
            messages.add(message);
            conversationRepository.save(new Conversation(lineage, messages, conversation.contextStart()));
        }
    }

    /**
     * Full stored log, including turns hidden by {@link #clear(String)}.
     */
    public List<ChatMessage> history(String lineage) {
        return conversationRepository.findByLineage(lineage)
                .map(c -> List.copyOf(c.messages()))
                .orElse(List.of());
    }

    /**
     * Turns sent to the model: those after the clear watermark, at most {@code max-history} of them,
     * then trimmed to the character budget.
     */
    public List<ChatMessage> contextWindow(String lineage) {
        var conversation = conversationRepository.findByLineage(lineage).orElse(null);
        if (conversation == null) {
            return List.of();
        }
        var messages = conversation.messages();
        var visible = messages.subList(Math.min(conversation.contextStart(), messages.size()), messages.size());
        var recent = ContextWindowTrimmer.lastN(visible, contextConfig.maxHistory());
        return List.copyOf(ContextWindowTrimmer.trimToLimit(recent, contextConfig.charsLimit()));
    }

    public void clear(String lineage) {
        synchronized (lockFor(lineage)) {
            var conversation = getOrCreate(lineage);
            conversationRepository.save(conversation.withContextStart(conversation.messages().size()));
        }
    }

    private Conversation getOrCreate(String lineage) {
        return conversationRepository.findByLineage(lineage)
                .orElseGet(() -> new Conversation(lineage, List.of(), 0));
    }

    private Object lockFor(String lineage) {
        return locks.computeIfAbsent(lineage, k -> new Object());
    }
}
