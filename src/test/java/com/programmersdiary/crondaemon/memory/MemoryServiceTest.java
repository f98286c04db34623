package com.programmersdiary.crondaemon.memory;

import com.programmersdiary.crondaemon.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    @TempDir
    Path dataDir;

    private MemoryRepository repository;
    private MemoryService service;

    @BeforeEach
    void setUp() throws IOException {
        repository = new MemoryRepository(dataDir.toString());
        repository.load();
        service = new MemoryService(repository, new MutableClock(NOW), 3);
    }

    @Test
    void remember_storesTrimmedFactsOnceIgnoringCase() {
        assertTrue(service.remember("  Likes hiking  "));
        assertFalse(service.remember("likes HIKING"));
        assertFalse(service.remember("   "));
        assertFalse(service.remember(null));

        assertEquals(List.of(new MemoryFact("Likes hiking", NOW)), service.facts());
    }

    @Test
    void facts_surviveRestart() throws IOException {
        service.remember("Works night shifts");

        var reloaded = new MemoryRepository(dataDir.toString());
        reloaded.load();

        assertEquals(List.of(new MemoryFact("Works night shifts", NOW)), reloaded.findAll());
        assertTrue(Files.exists(dataDir.resolve("memory.json")));
    }

    @Test
    void isLarge_onceWarnThresholdIsReached() {
        service.remember("one");
        service.remember("two");
        assertFalse(service.isLarge());

        service.remember("three");

        assertTrue(service.isLarge());
        assertEquals(3, service.lineCount());
        assertEquals("- one\n- two\n- three", service.render());
    }

    @Test
    void forget_emptiesMemoryOnDiskToo() throws IOException {
        service.remember("Has a cat");

        service.forget();

        var reloaded = new MemoryRepository(dataDir.toString());
        reloaded.load();
        assertTrue(reloaded.findAll().isEmpty());
        assertTrue(service.facts().isEmpty());
    }

    @Test
    void systemPrompt_isUnchangedWithoutFacts() {
        assertEquals("Base prompt", service.systemPrompt("Base prompt"));

        service.remember("Prefers metric units");

        assertEquals("Base prompt\n\nThings you remember about the user:\n- Prefers metric units",
                service.systemPrompt("Base prompt"));
        assertEquals("Things you remember about the user:\n- Prefers metric units", service.systemPrompt(""));
    }
}
