package com.programmersdiary.crondaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single control loop: evaluates every enabled job against each tick and dispatches the ones that
 * are due.
 *
 * <p>Ticks are processed one at a time in increasing order. A fire is recorded in the job store before
 * the job is handed to the executor, so a crash between the two loses that fire rather than repeating
 * it. When ticks were missed (a stall, or downtime since the last persisted checkpoint) only the minute
 * just before the current tick is caught up. Older missed minutes are dropped.
 */
@Component
public class SchedulerLoop implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final ScheduledJobRepository repository;
    private final ScheduledJobExecutor executor;
    private final TickSource tickSource;
    private final SchedulerConfig config;
    private final ReentrantLock tickLock = new ReentrantLock(true);
    private final Map<String, Optional<CronSchedule>> schedules = new ConcurrentHashMap<>();
    private volatile boolean evaluating;
    private volatile boolean running;
    private Tick lastTick;

    public SchedulerLoop(ScheduledJobRepository repository,
                         ScheduledJobExecutor executor,
                         TickSource tickSource,
                         SchedulerConfig config) {
        this.repository = repository;
        this.executor = executor;
        this.tickSource = tickSource;
        this.config = config;
    }

    /**
     * Evaluates one tick.
     *
     * @return ids of the jobs dispatched for this tick, including catch-up fires
     */
    public List<Long> onTick(Tick tick) {
        tickLock.lock();
        try {
            var previous = previousTick(tick);
            if (previous != null && !tick.isAfter(previous)) {
                log.warn("Dropping tick {}: not after last evaluated tick {}", tick, previous);
                return List.of();
            }
            evaluating = true;
            var fired = new ArrayList<Long>();
            boolean missedTicks = previous != null && tick.minutesSince(previous) > 1;
            if (missedTicks) {
                log.info("Ticks missed between {} and {}", previous, tick);
            }
            for (var job : repository.findAll(false)) {
                var schedule = scheduleFor(job);
                if (schedule.isEmpty()) {
                    continue;
                }
                if (schedule.get().matches(tick)) {
                    if (!job.hasFiredAt(tick) && fire(job, tick)) {
                        fired.add(job.id());
                    }
                } else if (missedTicks) {
                    var missed = tick.plusMinutes(-1);
                    if (isCatchUpDue(job, schedule.get(), missed) && fire(job, missed)) {
                        log.info("Job #{} caught up for missed tick {}", job.id(), missed);
                        fired.add(job.id());
                    }
                }
            }
            lastTick = tick;
            checkpoint(tick);
            return fired;
        } finally {
            evaluating = false;
            tickLock.unlock();
        }
    }

    public SchedulerState state() {
        if (evaluating) {
            return SchedulerState.EVALUATING;
        }
        return executor.runningCount() > 0 ? SchedulerState.AWAITING_EXECUTORS : SchedulerState.IDLE;
    }

    private Tick previousTick(Tick tick) {
        if (lastTick != null) {
            return lastTick;
        }
        return repository.lastEvaluatedTick()
                .map(instant -> Tick.of(instant, tick.offset()))
                .orElse(null);
    }

    private static boolean isCatchUpDue(ScheduledJob job, CronSchedule schedule, Tick missed) {
        return schedule.matches(missed)
                && !job.hasFiredAt(missed)
                && !firstTickAtOrAfter(job.createdAt(), missed).isAfter(missed);
    }

    private static Tick firstTickAtOrAfter(Instant instant, Tick reference) {
        var tick = Tick.of(instant, reference.offset());
        return tick.instant().isBefore(instant) ? tick.plusMinutes(1) : tick;
    }

    private boolean fire(ScheduledJob job, Tick tick) {
        if (!executor.tryReserve(job.id())) {
            log.warn("Skipping job #{} for tick {}: previous run still in progress", job.id(), tick);
            return false;
        }
        try {
            if (!repository.markFired(job.id(), tick.instant())) {
                executor.release(job.id());
                return false;
            }
        } catch (RuntimeException e) {
            executor.release(job.id());
            log.error("Skipping job #{} for tick {}: could not record the fire: {}", job.id(), tick, e.getMessage());
            return false;
        }
        executor.submit(job, tick);
        return true;
    }

    private Optional<CronSchedule> scheduleFor(ScheduledJob job) {
        return schedules.computeIfAbsent(job.cronExpression(), expression -> {
            try {
                return Optional.of(CronSchedule.parse(expression));
            } catch (InvalidScheduleException e) {
                log.warn("Job #{} has an unusable schedule and will not fire: {}", job.id(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    private void checkpoint(Tick tick) {
        try {
            repository.recordEvaluatedTick(tick.instant());
        } catch (RuntimeException e) {
            log.error("Could not checkpoint tick {}: {}", tick, e.getMessage());
        }
    }

    @Override
    public void start() {
        if (!config.enabled()) {
            log.info("Scheduler disabled");
            return;
        }
        tickSource.start(this::onTick);
        running = true;
        log.info("Scheduler started with {} enabled job(s)", repository.findAll(false).size());
    }

    @Override
    public void stop() {
        tickSource.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
