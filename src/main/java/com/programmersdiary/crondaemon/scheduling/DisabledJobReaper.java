package com.programmersdiary.crondaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DisabledJobReaper {

    private static final Logger log = LoggerFactory.getLogger(DisabledJobReaper.class);

    private final ScheduledJobService jobService;

    public DisabledJobReaper(ScheduledJobService jobService) {
        this.jobService = jobService;
    }

    @Scheduled(fixedDelayString = "${crondaemon.scheduler.reap-interval-ms:3600000}",
            initialDelayString = "${crondaemon.scheduler.reap-interval-ms:3600000}")
    public void reap() {
        try {
            jobService.reapDisabled();
        } catch (StoreWriteException e) {
            log.error("Reaping disabled jobs failed: {}", e.getMessage());
        }
    }
}
