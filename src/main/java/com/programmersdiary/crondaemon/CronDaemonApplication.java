package com.programmersdiary.crondaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CronDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronDaemonApplication.class, args);
    }
}
