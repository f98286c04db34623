package com.programmersdiary.crondaemon.scheduling;

import com.programmersdiary.crondaemon.chat.ChatMessage;
import com.programmersdiary.crondaemon.chat.ContextConfig;
import com.programmersdiary.crondaemon.chat.ConversationService;
import com.programmersdiary.crondaemon.chat.ScheduleBlockParser;
import com.programmersdiary.crondaemon.inference.InferenceService;
import com.programmersdiary.crondaemon.memory.MemoryBlockParser;
import com.programmersdiary.crondaemon.session.Session;
import com.programmersdiary.crondaemon.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs fired jobs on the execution pool and routes their output to attached sessions.
 *
 * <p>A job is reserved before it is marked fired and released when its run ends, so the same job never
 * runs twice at once. A failed run is recorded and not retried; the job stays enabled. Failing to store
 * the output in a conversation log does not stop it from being delivered.
 */
@Component
public class ScheduledJobExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobExecutor.class);

    private final Executor pool;
    private final InferenceService inferenceService;
    private final ConversationService conversationService;
    private final SessionRegistry sessionRegistry;
    private final ContextConfig contextConfig;
    private final Clock clock;
    private final int resultLimit;
    private final Set<Long> running = ConcurrentHashMap.newKeySet();
    private final Deque<JobResult> results = new ArrayDeque<>();

    public ScheduledJobExecutor(@Qualifier("jobExecutionPool") Executor pool,
                                InferenceService inferenceService,
                                ConversationService conversationService,
                                SessionRegistry sessionRegistry,
                                ContextConfig contextConfig,
                                SchedulerConfig schedulerConfig,
                                Clock clock) {
        this.pool = pool;
        this.inferenceService = inferenceService;
        this.conversationService = conversationService;
        this.sessionRegistry = sessionRegistry;
        this.contextConfig = contextConfig;
        this.clock = clock;
        this.resultLimit = schedulerConfig.recentResults();
    }

    public boolean tryReserve(long jobId) {
        return running.add(jobId);
    }

    public void release(long jobId) {
        running.remove(jobId);
    }

    public boolean isRunning(long jobId) {
        return running.contains(jobId);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Hands a reserved job to the pool. The reservation is released when the run ends or if the pool
     * refuses the task.
     */
    public void submit(ScheduledJob job, Tick tick) {
        try {
            pool.execute(() -> {
                try {
                    execute(job, tick);
                } finally {
                    release(job.id());
                }
            });
        } catch (RejectedExecutionException e) {
            release(job.id());
            log.error("Job #{} could not be started for tick {}: {}", job.id(), tick, e.getMessage());
            record(new JobResult(job.id(), job.task(), tick.instant(), clock.instant(), false,
                    "Rejected by execution pool"));
        }
    }

    JobResult execute(ScheduledJob job, Tick tick) {
        log.info("Job #{} fired for tick {}", job.id(), tick);
        JobResult result;
        try {
            var reply = inferenceService.generate(contextConfig.systemInstructions(), List.of(), job.message());
            var text = MemoryBlockParser.strip(ScheduleBlockParser.strip(reply));
            deliver(job, text);
            result = new JobResult(job.id(), job.task(), tick.instant(), clock.instant(), true, text);
        } catch (RuntimeException e) {
            log.error("Job #{} '{}' failed: {}", job.id(), job.task(), e.getMessage());
            result = new JobResult(job.id(), job.task(), tick.instant(), clock.instant(), false,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        record(result);
        return result;
    }

    private void deliver(ScheduledJob job, String text) {
        var recipients = sessionRegistry.attached(job.scope());
        if (recipients.isEmpty()) {
            log.info("Job #{} produced output but no {} session is attached", job.id(), job.scope());
            return;
        }
        Set<String> lineages = recipients.stream()
                .map(Session::lineage)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        for (var lineage : lineages) {
            try {
                conversationService.append(lineage, ChatMessage.scheduled(text));
            } catch (RuntimeException e) {
                log.warn("Job #{} output could not be stored in '{}', delivering anyway: {}",
                        job.id(), lineage, e.getMessage());
            }
        }
        var report = sessionRegistry.broadcast(format(job, text), job.scope());
        log.info("Job #{} delivered to {} session(s), {} failed",
                job.id(), report.delivered().size(), report.failed().size());
    }

    static String format(ScheduledJob job, String text) {
        return "⏰ #" + job.id() + " " + job.task() + "\n" + text;
    }

    private void record(JobResult result) {
        synchronized (results) {
            results.addLast(result);
            while (results.size() > resultLimit) {
                results.removeFirst();
            }
        }
    }

    /**
     * Most recent outcomes, oldest first.
     */
    public List<JobResult> recentResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    public List<JobResult> recentFailures() {
        return recentResults().stream().filter(r -> !r.success()).toList();
    }
}
