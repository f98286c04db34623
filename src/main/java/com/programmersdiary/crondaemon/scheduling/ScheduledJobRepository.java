package com.programmersdiary.crondaemon.scheduling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Durable job store backed by a single JSON file.
 *
 * <p>Every mutation writes the complete snapshot to a temporary file, forces it to disk and renames it
 * over {@code jobs.json} before returning. Writers are serialized by one lock; readers see the last
 * committed snapshot without locking. If the write fails the in-memory snapshot is left as it was.
 */
@Repository
public class ScheduledJobRepository {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobRepository.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path jobsFile;
    private final Clock clock;
    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public ScheduledJobRepository(
            @Value("${crondaemon.data-dir:${user.home}/.crondaemon}") String dataDir,
            Clock clock) {
        this.jobsFile = Path.of(dataDir, "jobs.json");
        this.clock = clock;
    }

    @PostConstruct
    public void load() throws IOException {
        if (Files.exists(jobsFile)) {
            var file = objectMapper.readValue(jobsFile.toFile(), JobStoreFile.class);
            var jobs = new TreeMap<Long, ScheduledJob>();
            if (file.jobs() != null) {
                file.jobs().forEach(job -> jobs.put(job.id(), job));
            }
            long nextId = Math.max(file.nextId(), jobs.isEmpty() ? 1 : jobs.lastKey() + 1);
            snapshot = new Snapshot(nextId, file.lastEvaluatedTick(), jobs);
            log.info("Loaded {} job(s) from {}", jobs.size(), jobsFile);
        }
    }

    public ScheduledJob create(JobDraft draft) {
        synchronized (writeLock) {
            var current = snapshot;
            var job = new ScheduledJob(current.nextId(), draft.scope(), draft.cronExpression(), draft.task(),
                    draft.message(), draft.createdBy(), clock.instant(), true, null, null);
            var jobs = new TreeMap<>(current.jobs());
            jobs.put(job.id(), job);
            commit(new Snapshot(current.nextId() + 1, current.lastEvaluatedTick(), jobs));
            return job;
        }
    }

    /**
     * Jobs ordered by id.
     */
    public List<ScheduledJob> findAll(boolean includeDisabled) {
        return snapshot.jobs().values().stream()
                .filter(job -> includeDisabled || job.enabled())
                .toList();
    }

    public Optional<ScheduledJob> findById(long id) {
        return Optional.ofNullable(snapshot.jobs().get(id));
    }

    public ScheduledJob get(long id) {
        return findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Soft-disables a job. Disabling an already disabled job changes nothing.
     */
    public ScheduledJob disable(long id, Instant at) {
        synchronized (writeLock) {
            var job = get(id);
            if (!job.enabled()) {
                return job;
            }
            var disabled = job.disable(at);
            commit(snapshot.with(disabled));
            return disabled;
        }
    }

    /**
     * Records that a job fired for the given tick.
     *
     * @return false, without writing, when the job already fired at or after that tick
     */
    public boolean markFired(long id, Instant tick) {
        synchronized (writeLock) {
            var job = get(id);
            if (job.lastFiredAt() != null && !job.lastFiredAt().isBefore(tick)) {
                return false;
            }
            commit(snapshot.with(job.withLastFiredAt(tick)));
            return true;
        }
    }

    /**
     * Hard-deletes jobs that were disabled before the cutoff.
     */
    public int purgeDisabledBefore(Instant cutoff) {
        synchronized (writeLock) {
            var current = snapshot;
            var jobs = new TreeMap<>(current.jobs());
            boolean removed = jobs.values().removeIf(job -> !job.enabled()
                    && job.disabledAt() != null
                    && job.disabledAt().isBefore(cutoff));
            if (!removed) {
                return 0;
            }
            int count = current.jobs().size() - jobs.size();
            commit(new Snapshot(current.nextId(), current.lastEvaluatedTick(), jobs));
            return count;
        }
    }

    public Optional<Instant> lastEvaluatedTick() {
        return Optional.ofNullable(snapshot.lastEvaluatedTick());
    }

    public void recordEvaluatedTick(Instant tick) {
        synchronized (writeLock) {
            var current = snapshot;
            if (current.lastEvaluatedTick() != null && !tick.isAfter(current.lastEvaluatedTick())) {
                return;
            }
            commit(new Snapshot(current.nextId(), tick, current.jobs()));
        }
    }

    private void commit(Snapshot next) {
        persist(next);
        snapshot = next;
    }

    private void persist(Snapshot next) {
        var tmp = jobsFile.resolveSibling(jobsFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(jobsFile.getParent());
            var bytes = objectMapper.writeValueAsBytes(
                    new JobStoreFile(next.nextId(), next.lastEvaluatedTick(), List.copyOf(next.jobs().values())));
            try (var channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                var buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, jobsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreWriteException("Failed to write job store " + jobsFile, e);
        }
    }

    private record Snapshot(long nextId, Instant lastEvaluatedTick, SortedMap<Long, ScheduledJob> jobs) {

        static final Snapshot EMPTY = new Snapshot(1, null, new TreeMap<>());

        Snapshot {
            jobs = Collections.unmodifiableSortedMap(new TreeMap<>(jobs));
        }

        Snapshot with(ScheduledJob job) {
            var updated = new TreeMap<>(jobs);
            updated.put(job.id(), job);
            return new Snapshot(nextId, lastEvaluatedTick, updated);
        }
    }
}
