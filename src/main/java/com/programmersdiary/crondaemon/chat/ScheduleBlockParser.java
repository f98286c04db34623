package com.programmersdiary.crondaemon.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds job requests the model embeds in its answer as fenced blocks:
 * <pre>
 * ```cron
 * {"schedule": "0 9 * * *", "task": "Morning fact", "message": "Tell me a fun fact"}
 * ```
 * </pre>
 */
public final class ScheduleBlockParser {

    private static final Pattern CRON_BLOCK = Pattern.compile("```cron\\s*\\n(.*?)\\n\\s*```", Pattern.DOTALL);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private ScheduleBlockParser() {
    }

    public record ScheduleBlock(String schedule, String task, String message) {
    }

    public record ParseResult(List<ScheduleBlock> blocks, List<String> errors) {
    }

    public static ParseResult parse(String text) {
        var blocks = new ArrayList<ScheduleBlock>();
        var errors = new ArrayList<String>();
        if (text == null) {
            return new ParseResult(blocks, errors);
        }
        var matcher = CRON_BLOCK.matcher(text);
        while (matcher.find()) {
            var body = matcher.group(1).strip();
            try {
                var node = OBJECT_MAPPER.readTree(body);
                if (node == null || !node.isObject()) {
                    errors.add("Cron block is not a JSON object: " + body);
                    continue;
                }
                var schedule = node.path("schedule");
                var task = node.path("task");
                var message = node.path("message");
                if (!schedule.isTextual() || !task.isTextual() || !message.isTextual()) {
                    errors.add("Cron block needs \"schedule\", \"task\" and \"message\": " + body);
                    continue;
                }
                blocks.add(new ScheduleBlock(schedule.asText(), task.asText(), message.asText()));
            } catch (JsonProcessingException e) {
                errors.add("Cron block is not valid JSON: " + body);
            }
        }
        return new ParseResult(blocks, errors);
    }

    /**
     * The answer with every cron block removed, trimmed.
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        return CRON_BLOCK.matcher(text).replaceAll("").strip();
    }
}
