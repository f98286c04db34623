package com.programmersdiary.crondaemon.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Facts the model was asked to remember, kept in {@code memory.json} under the data directory.
 */
@Repository
public class MemoryRepository {

    private static final Logger log = LoggerFactory.getLogger(MemoryRepository.class);
    private static final TypeReference<List<MemoryFact>> FACT_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path file;
    private volatile List<MemoryFact> facts = List.of();

    public MemoryRepository(@Value("${crondaemon.data-dir:${user.home}/.crondaemon}") String dataDir) {
        this.file = Path.of(dataDir, "memory.json");
    }

    @PostConstruct
    public void load() throws IOException {
        Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            return;
        }
        var loaded = objectMapper.readValue(file.toFile(), FACT_LIST_TYPE);
        facts = loaded != null ? List.copyOf(loaded) : List.of();
        log.info("Loaded {} remembered fact(s) from {}", facts.size(), file);
    }

    public List<MemoryFact> findAll() {
        return facts;
    }

    public synchronized void saveAll(List<MemoryFact> updated) {
        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), updated);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        facts = List.copyOf(updated);
    }
}
