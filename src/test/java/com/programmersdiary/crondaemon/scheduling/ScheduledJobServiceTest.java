package com.programmersdiary.crondaemon.scheduling;

import com.programmersdiary.crondaemon.testsupport.DaemonFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledJobServiceTest {

    @TempDir
    Path dataDir;

    private DaemonFixture fixture;
    private ScheduledJobService service;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new DaemonFixture(dataDir);
        service = fixture.jobService;
    }

    @Test
    void create_rejectsInvalidExpressionWithoutStoring() {
        assertThrows(InvalidScheduleException.class,
                () -> service.create("61 * * * *", "bad", "never", JobScope.ALL, "terminal"));

        assertTrue(service.list(true).isEmpty());
    }

    @Test
    void create_rejectsEmptyMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create("* * * * *", "task", "  ", JobScope.ALL, "terminal"));
    }

    @Test
    void create_storesNormalizedExpressionAndDerivesLabel() {
        var message = "Write me a short poem about the sea and the sky at dawn, please";

        var job = service.create("0   9 * *  *", null, message, null, "telegram");

        assertEquals("0 9 * * *", job.cronExpression());
        assertEquals(message.substring(0, 50) + "...", job.task());
        assertEquals(JobScope.ALL, job.scope());
        assertEquals("telegram", job.createdBy());
    }

    @Test
    void nextFire_usesClockAndSkipsDisabledJobs() {
        fixture.clock.set(Instant.parse("2024-01-01T08:59:30Z"));
        var job = service.create("0 9 * * *", "morning", "Good morning", JobScope.ALL, "terminal");

        assertEquals(Instant.parse("2024-01-01T09:00:00Z"), service.nextFire(job).orElseThrow());

        var cancelled = service.cancel(job.id());
        assertTrue(service.nextFire(cancelled).isEmpty());
    }

    @Test
    void cancel_unknownJobThrows() {
        assertThrows(JobNotFoundException.class, () -> service.cancel(7));
    }

    @Test
    void reapDisabled_purgesOnlyAfterRetention() {
        var job = service.create("* * * * *", "tick", "Say tick", JobScope.ALL, "terminal");
        service.cancel(job.id());

        fixture.clock.advance(Duration.ofDays(29));
        assertEquals(0, service.reapDisabled());

        fixture.clock.advance(Duration.ofDays(2));
        assertEquals(1, service.reapDisabled());
        assertTrue(service.list(true).isEmpty());
    }
}
