package com.programmersdiary.crondaemon.scheduling;

import com.programmersdiary.crondaemon.chat.ChatMessage;
import com.programmersdiary.crondaemon.inference.InferenceUnavailableException;
import com.programmersdiary.crondaemon.session.TransportKind;
import com.programmersdiary.crondaemon.testsupport.DaemonFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.programmersdiary.crondaemon.testsupport.DaemonFixture.tick;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledJobExecutorTest {

    private static final Tick TEN = tick("2024-01-01T10:00:00Z");

    @TempDir
    Path dataDir;

    @Test
    void success_appendsScheduledTurnAndBroadcastsToEveryScopedSession() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.inferenceClient.respondWith("Octopuses have three hearts.");
        var terminalOut = new CopyOnWriteArrayList<String>();
        var telegramOut = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", terminalOut::add);
        fixture.clock.advance(Duration.ofSeconds(1));
        fixture.sessionRegistry.attach(TransportKind.TELEGRAM, "telegram", telegramOut::add);
        var job = fixture.jobService.create("0 9 * * *", "Fun fact", "Tell me a fun fact", JobScope.ALL, "terminal");

        var result = fixture.jobExecutor.execute(job, TEN);

        assertTrue(result.success());
        assertEquals(List.of("⏰ #1 Fun fact\nOctopuses have three hearts."), terminalOut);
        assertEquals(terminalOut, telegramOut);
        var terminalHistory = fixture.conversationService.history("terminal");
        assertEquals(1, terminalHistory.size());
        assertTrue(terminalHistory.get(0).isScheduled());
        assertEquals("assistant", terminalHistory.get(0).role());
        assertEquals(1, fixture.conversationService.history("telegram").size());
        assertEquals(List.of(result), fixture.jobExecutor.recentResults());
    }

    @Test
    void scopedJob_reachesOnlyMatchingSessions() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        var terminalOut = new CopyOnWriteArrayList<String>();
        var telegramOut = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", terminalOut::add);
        fixture.sessionRegistry.attach(TransportKind.TELEGRAM, "telegram", telegramOut::add);
        var job = fixture.jobService.create("* * * * *", "tg only", "Ping", JobScope.TELEGRAM, "telegram");

        fixture.jobExecutor.execute(job, TEN);

        assertTrue(terminalOut.isEmpty());
        assertEquals(1, telegramOut.size());
        assertTrue(fixture.conversationService.history("terminal").isEmpty());
    }

    @Test
    void prompt_isTheTriggerMessageWithoutConversationContext() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.conversationService.append("terminal", ChatMessage.of("user", "earlier question"));
        fixture.conversationService.append("terminal", ChatMessage.of("assistant", "earlier answer"));
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", text -> { });
        var job = fixture.jobService.create("* * * * *", "quote", "Give me a quote", JobScope.ALL, "terminal");

        fixture.jobExecutor.execute(job, TEN);

        var request = fixture.inferenceClient.requests().get(0);
        assertEquals("Give me a quote", request.prompt());
        assertTrue(request.context().isEmpty());
        assertEquals("You are a test assistant.", request.systemPrompt());
        assertEquals("test-model", request.model());
        assertEquals("-1m", request.keepAlive());
    }

    @Test
    void cronBlocksInScheduledOutput_areStrippedAndNotScheduled() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.inferenceClient.respondWith("""
                Here you go.
                ```cron
                {"schedule": "* * * * *", "task": "spam", "message": "more"}
                ```""");
        var out = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", out::add);
        var job = fixture.jobService.create("* * * * *", "reply", "Answer", JobScope.ALL, "terminal");

        fixture.jobExecutor.execute(job, TEN);

        assertEquals(List.of("⏰ #1 reply\nHere you go."), out);
        assertEquals(1, fixture.jobService.list(true).size());
    }

    @Test
    void conversationWriteFailure_stillDeliversAndRecordsSuccess() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.inferenceClient.respondWith("Stand up and stretch.");
        var blocked = dataDir.resolve("conversations").resolve("terminal.json");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep"), "x");
        var out = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", out::add);
        var job = fixture.jobService.create("* * * * *", "stretch", "Remind me to stretch", JobScope.ALL, "terminal");

        var result = fixture.jobExecutor.execute(job, TEN);

        assertTrue(result.success());
        assertEquals(List.of("⏰ #1 stretch\nStand up and stretch."), out);
    }

    @Test
    void memoryBlocksInScheduledOutput_areStrippedAndNotRemembered() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.inferenceClient.respondWith("""
                Good morning!
                ```memory
                The user wakes up at nine
                ```""");
        var out = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", out::add);
        var job = fixture.jobService.create("0 9 * * *", "greet", "Greet me", JobScope.ALL, "terminal");

        fixture.jobExecutor.execute(job, TEN);

        assertEquals(List.of("⏰ #1 greet\nGood morning!"), out);
        assertTrue(fixture.memoryService.facts().isEmpty());
    }

    @Test
    void timeout_isRecordedAndJobStaysEnabled() throws IOException {
        var fixture = new DaemonFixture(dataDir, Runnable::run, 100, 20);
        var never = new CountDownLatch(1);
        fixture.inferenceClient.respondWith(request -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        });
        var out = new CopyOnWriteArrayList<String>();
        fixture.sessionRegistry.attach(TransportKind.TERMINAL, "terminal", out::add);
        var job = fixture.jobService.create("* * * * *", "slow", "Think hard", JobScope.ALL, "terminal");

        var result = fixture.jobExecutor.execute(job, TEN);

        assertFalse(result.success());
        assertTrue(result.detail().startsWith("InferenceTimeoutException"));
        assertTrue(out.isEmpty());
        assertTrue(fixture.jobRepository.get(job.id()).enabled());
        assertEquals(List.of(result), fixture.jobExecutor.recentFailures());
    }

    @Test
    void unavailableModel_isRecordedAsFailure() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        fixture.inferenceClient.respondWith(request -> {
            throw new InferenceUnavailableException("connection refused", null);
        });
        var job = fixture.jobService.create("* * * * *", "down", "Hello?", JobScope.ALL, "terminal");

        var result = fixture.jobExecutor.execute(job, TEN);

        assertFalse(result.success());
        assertTrue(result.detail().contains("connection refused"));
    }

    @Test
    void recentResults_keepsOnlyTheNewest() throws IOException {
        var fixture = new DaemonFixture(dataDir, Runnable::run, 2000, 2);
        var job = fixture.jobService.create("* * * * *", "count", "Count", JobScope.ALL, "terminal");

        fixture.jobExecutor.execute(job, TEN);
        fixture.jobExecutor.execute(job, TEN.plusMinutes(1));
        fixture.jobExecutor.execute(job, TEN.plusMinutes(2));

        var results = fixture.jobExecutor.recentResults();
        assertEquals(2, results.size());
        assertEquals(TEN.plusMinutes(2).instant(), results.get(1).tick());
    }

    @Test
    void submit_releasesReservationWhenPoolRejects() throws IOException {
        var fixture = new DaemonFixture(dataDir, task -> {
            throw new RejectedExecutionException("full");
        }, 2000, 20);
        var job = fixture.jobService.create("* * * * *", "rejected", "Ping", JobScope.ALL, "terminal");
        assertTrue(fixture.jobExecutor.tryReserve(job.id()));

        fixture.jobExecutor.submit(job, TEN);

        assertFalse(fixture.jobExecutor.isRunning(job.id()));
        assertFalse(fixture.jobExecutor.recentFailures().isEmpty());
    }

    @Test
    void submit_releasesReservationAfterRun() throws IOException {
        var fixture = new DaemonFixture(dataDir);
        var job = fixture.jobService.create("* * * * *", "quick", "Ping", JobScope.ALL, "terminal");
        assertTrue(fixture.jobExecutor.tryReserve(job.id()));
        assertFalse(fixture.jobExecutor.tryReserve(job.id()));

        fixture.jobExecutor.submit(job, TEN);

        assertFalse(fixture.jobExecutor.isRunning(job.id()));
        assertEquals(1, fixture.inferenceClient.callCount());
    }
}
