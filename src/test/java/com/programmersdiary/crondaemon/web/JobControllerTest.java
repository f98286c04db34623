package com.programmersdiary.crondaemon.web;

import com.programmersdiary.crondaemon.scheduling.JobScope;
import com.programmersdiary.crondaemon.testsupport.DaemonFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobControllerTest {

    @TempDir
    Path dataDir;

    private DaemonFixture fixture;
    private JobController controller;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new DaemonFixture(dataDir);
        controller = new JobController(fixture.jobService, fixture.jobExecutor);
    }

    @Test
    void createJob_usesApiAsCreatorAndParsesScope() {
        var job = controller.createJob(new CreateJobRequest("*/15 * * * *", "Water", "Remind me to drink", "telegram"));

        assertEquals(1, job.id());
        assertEquals("api", job.createdBy());
        assertEquals(JobScope.TELEGRAM, job.scope());
        assertEquals(1, controller.listJobs(false).size());
    }

    @Test
    void createJob_rejectsInvalidInputWithBadRequest() {
        var badCron = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(new CreateJobRequest("61 * * * *", "x", "y", null)));
        var badScope = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(new CreateJobRequest("0 * * * *", "x", "y", "email")));
        var noMessage = assertThrows(ResponseStatusException.class,
                () -> controller.createJob(new CreateJobRequest("0 * * * *", "x", " ", null)));

        assertEquals(HttpStatus.BAD_REQUEST, badCron.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, badScope.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, noMessage.getStatusCode());
        assertTrue(controller.listJobs(true).isEmpty());
    }

    @Test
    void cancelJob_disablesAndHidesFromDefaultListing() {
        controller.createJob(new CreateJobRequest("0 9 * * *", "Morning", "Good morning", null));

        controller.cancelJob(1);

        assertTrue(controller.listJobs(false).isEmpty());
        assertEquals(1, controller.listJobs(true).size());
        assertFalse(controller.getJob(1).enabled());
    }

    @Test
    void unknownJob_isNotFound() {
        var onGet = assertThrows(ResponseStatusException.class, () -> controller.getJob(42));
        var onDelete = assertThrows(ResponseStatusException.class, () -> controller.cancelJob(42));

        assertEquals(HttpStatus.NOT_FOUND, onGet.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, onDelete.getStatusCode());
    }

    @Test
    void getResults_startsEmpty() {
        assertTrue(controller.getResults().isEmpty());
    }
}
