package com.programmersdiary.crondaemon.scheduling;

import java.time.Instant;

public record JobResult(long jobId, String task, Instant tick, Instant executedAt, boolean success, String detail) {
}
