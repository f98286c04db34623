package com.programmersdiary.crondaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for creating, listing and cancelling jobs. Every path that creates a job, whether a
 * command, a model reply or the REST API, validates the expression here.
 */
@Service
public class ScheduledJobService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobService.class);
    private static final int TASK_LABEL_LENGTH = 50;

    private final ScheduledJobRepository repository;
    private final SchedulerConfig config;
    private final Clock clock;

    public ScheduledJobService(ScheduledJobRepository repository, SchedulerConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param task short label; derived from the message when blank
     * @throws InvalidScheduleException if the expression does not parse
     */
    public ScheduledJob create(String cronExpression, String task, String message, JobScope scope, String createdBy) {
        var schedule = CronSchedule.parse(cronExpression);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Job message must not be empty");
        }
        var label = task == null || task.isBlank() ? taskLabel(message) : task.strip();
        var job = repository.create(new JobDraft(scope != null ? scope : JobScope.ALL,
                schedule.expression(), label, message.strip(), createdBy));
        log.info("Scheduled job #{} '{}' with cron '{}'", job.id(), job.task(), job.cronExpression());
        return job;
    }

    public List<ScheduledJob> list(boolean includeDisabled) {
        return repository.findAll(includeDisabled);
    }

    public ScheduledJob get(long id) {
        return repository.get(id);
    }

    public ScheduledJob cancel(long id) {
        var job = repository.disable(id, clock.instant());
        log.info("Cancelled job #{}", id);
        return job;
    }

    /**
     * Next time an enabled job is due, empty for disabled jobs or expressions that never match.
     */
    public Optional<Instant> nextFire(ScheduledJob job) {
        if (!job.enabled()) {
            return Optional.empty();
        }
        try {
            return CronSchedule.parse(job.cronExpression())
                    .nextMatchAfter(Tick.of(clock.instant(), config.offset()))
                    .map(Tick::instant);
        } catch (InvalidScheduleException e) {
            return Optional.empty();
        }
    }

    public int reapDisabled() {
        var cutoff = clock.instant().minus(Duration.ofDays(config.retentionDays()));
        int purged = repository.purgeDisabledBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} disabled job(s) cancelled before {}", purged, cutoff);
        }
        return purged;
    }

    static String taskLabel(String message) {
        var text = message.strip();
        return text.length() > TASK_LABEL_LENGTH ? text.substring(0, TASK_LABEL_LENGTH) + "..." : text;
    }
}
