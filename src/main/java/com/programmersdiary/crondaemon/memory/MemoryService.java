package com.programmersdiary.crondaemon.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Long-lived facts about the user. They are shared by every session and added to the system prompt
 * of each chat turn.
 */
@Service
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    private final MemoryRepository repository;
    private final Clock clock;
    private final int warnLines;

    public MemoryService(MemoryRepository repository,
                         Clock clock,
                         @Value("${crondaemon.memory.warn-lines:50}") int warnLines) {
        this.repository = repository;
        this.clock = clock;
        this.warnLines = Math.max(1, warnLines);
    }

    /**
     * @return false when the fact is blank or already remembered
     */
    public synchronized boolean remember(String fact) {
        if (fact == null || fact.isBlank()) {
            return false;
        }
        var text = fact.strip();
        var key = text.toLowerCase(Locale.ROOT);
        var current = repository.findAll();
        if (current.stream().anyMatch(f -> f.text().toLowerCase(Locale.ROOT).equals(key))) {
            return false;
        }
        var updated = new ArrayList<>(current);
        updated.add(new MemoryFact(text, clock.instant()));
        repository.saveAll(updated);
        log.info("Remembered fact #{}", updated.size());
        return true;
    }

    public List<MemoryFact> facts() {
        return repository.findAll();
    }

    public synchronized void forget() {
        repository.saveAll(List.of());
        log.info("All remembered facts forgotten");
    }

    public int lineCount() {
        return repository.findAll().size();
    }

    public boolean isLarge() {
        return lineCount() >= warnLines;
    }

    /**
     * The remembered facts as a bullet list, one per line.
     */
    public String render() {
        return repository.findAll().stream()
                .map(f -> "- " + f.text())
                .collect(Collectors.joining("\n"));
    }

    public String systemPrompt(String base) {
        var facts = repository.findAll();
        if (facts.isEmpty()) {
            return base;
        }
        var prefix = base == null || base.isBlank() ? "" : base.strip() + "\n\n";
        return prefix + "Things you remember about the user:\n" + render();
    }
}
