package com.programmersdiary.crondaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

@Component
public class MinuteTickSource implements TickSource {

    private static final Logger log = LoggerFactory.getLogger(MinuteTickSource.class);
    private static final String EVERY_MINUTE = "0 * * * * *";

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final SchedulerConfig config;
    private ScheduledFuture<?> future;

    public MinuteTickSource(TaskScheduler taskScheduler, Clock clock, SchedulerConfig config) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public synchronized void start(Consumer<Tick> listener) {
        if (future != null) {
            return;
        }
        future = taskScheduler.schedule(() -> emit(listener), new CronTrigger(EVERY_MINUTE, config.offset()));
        log.info("Minute ticks started in offset {}", config.offset().getId());
    }

    @Override
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("Minute ticks stopped");
        }
    }

    private void emit(Consumer<Tick> listener) {
        // the trigger can run a few ms early or late; round to the nearest minute
        var tick = Tick.of(clock.instant().plusSeconds(30), config.offset());
        try {
            listener.accept(tick);
        } catch (RuntimeException e) {
            log.error("Tick {} failed", tick, e);
        }
    }
}
