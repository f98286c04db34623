package com.programmersdiary.crondaemon.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds facts the model asks to keep, written as fenced blocks with one fact per line:
 * <pre>
 * ```memory
 * The user's name is Ada
 * ```
 * </pre>
 */
public final class MemoryBlockParser {

    private static final Pattern MEMORY_BLOCK = Pattern.compile("```memory\\s*\\n(.*?)\\n?\\s*```", Pattern.DOTALL);

    private MemoryBlockParser() {
    }

    public static List<String> parse(String text) {
        var facts = new ArrayList<String>();
        if (text == null) {
            return facts;
        }
        var matcher = MEMORY_BLOCK.matcher(text);
        while (matcher.find()) {
            for (var line : matcher.group(1).split("\\R")) {
                var fact = line.strip();
                if (fact.startsWith("- ")) {
                    fact = fact.substring(2).strip();
                }
                if (!fact.isEmpty()) {
                    facts.add(fact);
                }
            }
        }
        return facts;
    }

    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        return MEMORY_BLOCK.matcher(text).replaceAll("").strip();
    }
}
