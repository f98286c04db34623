package com.programmersdiary.crondaemon.command;

import com.programmersdiary.crondaemon.inference.ModelConfig;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobExecutor;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobService;
import com.programmersdiary.crondaemon.session.SessionRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class StatusService {

    private final ModelConfig modelConfig;
    private final ScheduledJobService jobService;
    private final SessionRegistry sessionRegistry;
    private final ScheduledJobExecutor jobExecutor;
    private final Clock clock;
    private final Instant startedAt;

    public StatusService(ModelConfig modelConfig,
                         ScheduledJobService jobService,
                         SessionRegistry sessionRegistry,
                         ScheduledJobExecutor jobExecutor,
                         Clock clock) {
        this.modelConfig = modelConfig;
        this.jobService = jobService;
        this.sessionRegistry = sessionRegistry;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public StatusReport status() {
        return new StatusReport(
                modelConfig.name(),
                modelConfig.baseUrl(),
                Duration.between(startedAt, clock.instant()),
                jobService.list(false).size(),
                sessionRegistry.attachedCount(),
                jobExecutor.recentFailures());
    }
}
