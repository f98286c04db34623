package com.programmersdiary.crondaemon.chat;

import com.programmersdiary.crondaemon.inference.InferenceException;
import com.programmersdiary.crondaemon.inference.InferenceService;
import com.programmersdiary.crondaemon.memory.MemoryBlockParser;
import com.programmersdiary.crondaemon.memory.MemoryService;
import com.programmersdiary.crondaemon.scheduling.JobScope;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final ConversationService conversationService;
    private final InferenceService inferenceService;
    private final ScheduledJobService jobService;
    private final MemoryService memoryService;
    private final ContextConfig contextConfig;

    public ChatService(ConversationService conversationService,
                       InferenceService inferenceService,
                       ScheduledJobService jobService,
                       MemoryService memoryService,
                       ContextConfig contextConfig) {
        this.conversationService = conversationService;
        this.inferenceService = inferenceService;
        this.jobService = jobService;
        this.memoryService = memoryService;
        this.contextConfig = contextConfig;
    }

    /**
     * Sends one user message in the given lineage and returns the answer with cron and memory blocks
     * removed. Jobs and facts requested by the model are stored before this returns. When the model call fails the
     * user turn is kept but no assistant turn is stored.
     */
    public ChatReply chat(String lineage, String userText) {
        var context = conversationService.contextWindow(lineage);
        conversationService.append(lineage, ChatMessage.of("user", userText));

        String response;
        try {
            var systemPrompt = memoryService.systemPrompt(contextConfig.systemInstructions());
            response = inferenceService.generate(systemPrompt, context, userText);
        } catch (InferenceException e) {
            log.error("Chat in '{}' failed: {}", lineage, e.getMessage());
            return new ChatReply("Sorry, I had trouble thinking about that. Error: " + e.getMessage(), List.of());
        }

        var notices = new ArrayList<String>();
        var parsed = ScheduleBlockParser.parse(response);
        if (!parsed.errors().isEmpty()) {
            notices.add("⚠️ Cron job errors:\n• " + String.join("\n• ", parsed.errors()));
        }
        for (var block : parsed.blocks()) {
            try {
                var job = jobService.create(block.schedule(), block.task(), block.message(), JobScope.ALL, lineage);
                notices.add("✅ Scheduled job #" + job.id() + ": " + job.task() + "\nSchedule: " + job.cronExpression());
            } catch (IllegalArgumentException e) {
                notices.add("⚠️ Could not schedule '" + block.task() + "': " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Could not store job from chat in '{}'", lineage, e);
                notices.add("⚠️ Could not schedule '" + block.task() + "': " + e.getMessage());
            }
        }

        rememberFacts(response, notices);

        conversationService.append(lineage, ChatMessage.of("assistant", response));
        var shown = MemoryBlockParser.strip(ScheduleBlockParser.strip(response));
        return new ChatReply(shown, List.copyOf(notices));
    }

    private void rememberFacts(String response, List<String> notices) {
        boolean remembered = false;
        for (var fact : MemoryBlockParser.parse(response)) {
            try {
                if (memoryService.remember(fact)) {
                    notices.add("🧠 Remembered: " + fact);
                    remembered = true;
                }
            } catch (RuntimeException e) {
                log.error("Could not remember fact: {}", e.getMessage());
                notices.add("⚠️ Could not remember '" + fact + "': " + e.getMessage());
            }
        }
        if (remembered && memoryService.isLarge()) {
            notices.add("⚠️ Your memory file is getting large (" + memoryService.lineCount() + " lines).\n"
                    + "Consider using /forget to clear old memories.");
        }
    }
}
