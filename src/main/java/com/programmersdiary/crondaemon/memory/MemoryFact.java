package com.programmersdiary.crondaemon.memory;

import java.time.Instant;

public record MemoryFact(String text, Instant savedAt) {
}
