package com.programmersdiary.crondaemon.scheduling;

import java.time.Instant;
import java.util.List;

/**
 * On-disk layout of {@code jobs.json}.
 */
record JobStoreFile(long nextId, Instant lastEvaluatedTick, List<ScheduledJob> jobs) {
}
