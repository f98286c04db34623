package com.programmersdiary.crondaemon.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ConversationRepository {

    private static final Logger log = LoggerFactory.getLogger(ConversationRepository.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path conversationsDir;
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    public ConversationRepository(
            @Value("${crondaemon.data-dir:${user.home}/.crondaemon}") String dataDir) {
        this.conversationsDir = Path.of(dataDir, "conversations");
    }

    @PostConstruct
    public void load() throws IOException {
        Files.createDirectories(conversationsDir);
        try (var stream = Files.list(conversationsDir)) {
            stream.filter(p -> p.toString().endsWith(".json"))
                    .forEach(p -> {
                        try {
                            var conv = objectMapper.readValue(p.toFile(), Conversation.class);
                            conversations.put(conv.lineage(), conv);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
        }
        log.info("Loaded {} conversation(s) from {}", conversations.size(), conversationsDir);
    }

    public List<Conversation> findAll() {
        return List.copyOf(conversations.values());
    }

    public Optional<Conversation> findByLineage(String lineage) {
        return Optional.ofNullable(conversations.get(lineage));
    }

    public Conversation save(Conversation conversation) {
        persist(conversation);
        conversations.put(conversation.lineage(), conversation);
        return conversation;
    }

    private void persist(Conversation conversation) {
        var file = conversationsDir.resolve(fileName(conversation.lineage()));
        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(conversationsDir);
            objectMapper.writeValue(tmp.toFile(), conversation);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String fileName(String lineage) {
        return lineage.replaceAll("[^A-Za-z0-9_.-]", "_") + ".json";
    }
}
