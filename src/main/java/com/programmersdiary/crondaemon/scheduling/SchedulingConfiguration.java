package com.programmersdiary.crondaemon.scheduling;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class SchedulingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor jobExecutionPool(SchedulerConfig config) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.executorThreads());
        executor.setMaxPoolSize(config.executorThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
