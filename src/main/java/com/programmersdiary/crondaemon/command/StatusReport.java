package com.programmersdiary.crondaemon.command;

import com.programmersdiary.crondaemon.scheduling.JobResult;

import java.time.Duration;
import java.util.List;

public record StatusReport(String model,
                           String host,
                           Duration uptime,
                           int activeJobs,
                           int attachedSessions,
                           List<JobResult> recentFailures) {

    public String format() {
        var sb = new StringBuilder("📊 Status\n\n")
                .append("Model: ").append(model).append('\n')
                .append("Host: ").append(host).append('\n')
                .append("Uptime: ").append(formatUptime(uptime)).append('\n')
                .append("Scheduled jobs: ").append(activeJobs).append('\n')
                .append("Attached sessions: ").append(attachedSessions);
        if (!recentFailures.isEmpty()) {
            sb.append("\n\nRecent failures:");
            recentFailures.forEach(f -> sb.append("\n• #").append(f.jobId()).append(' ')
                    .append(f.task()).append(" at ").append(f.tick()).append(": ").append(f.detail()));
        }
        return sb.toString();
    }

    static String formatUptime(Duration uptime) {
        long days = uptime.toDays();
        long hours = uptime.toHoursPart();
        long minutes = uptime.toMinutesPart();
        return days > 0
                ? days + "d " + hours + "h " + minutes + "m"
                : hours + "h " + minutes + "m";
    }
}
