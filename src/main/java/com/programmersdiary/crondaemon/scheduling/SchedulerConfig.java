package com.programmersdiary.crondaemon.scheduling;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

@Component
public class SchedulerConfig {

    private final boolean enabled;
    private final ZoneOffset offset;
    private final int executorThreads;
    private final int retentionDays;
    private final int recentResults;

    public SchedulerConfig(
            @Value("${crondaemon.scheduler.enabled:true}") boolean enabled,
            @Value("${crondaemon.scheduler.zone-offset:Z}") String zoneOffset,
            @Value("${crondaemon.scheduler.executor-threads:4}") int executorThreads,
            @Value("${crondaemon.scheduler.retention-days:30}") int retentionDays,
            @Value("${crondaemon.scheduler.recent-results:20}") int recentResults) {
        this.enabled = enabled;
        this.offset = ZoneOffset.of(zoneOffset);
        this.executorThreads = Math.max(1, executorThreads);
        this.retentionDays = Math.max(0, retentionDays);
        this.recentResults = Math.max(1, recentResults);
    }

    public boolean enabled() {
        return enabled;
    }

    public ZoneOffset offset() {
        return offset;
    }

    public int executorThreads() {
        return executorThreads;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public int recentResults() {
        return recentResults;
    }
}
