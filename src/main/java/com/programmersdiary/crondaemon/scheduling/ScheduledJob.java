package com.programmersdiary.crondaemon.scheduling;

import java.time.Instant;

public record ScheduledJob(
        long id,
        JobScope scope,
        String cronExpression,
        String task,
        String message,
        String createdBy,
        Instant createdAt,
        boolean enabled,
        Instant lastFiredAt,
        Instant disabledAt) {

    public ScheduledJob withLastFiredAt(Instant firedAt) {
        return new ScheduledJob(id, scope, cronExpression, task, message, createdBy, createdAt,
                enabled, firedAt, disabledAt);
    }

    public ScheduledJob disable(Instant at) {
        return new ScheduledJob(id, scope, cronExpression, task, message, createdBy, createdAt,
                false, lastFiredAt, at);
    }

    public boolean hasFiredAt(Tick tick) {
        return lastFiredAt != null && !lastFiredAt.isBefore(tick.instant());
    }
}
