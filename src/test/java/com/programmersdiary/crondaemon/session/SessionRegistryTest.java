package com.programmersdiary.crondaemon.session;

import com.programmersdiary.crondaemon.scheduling.JobScope;
import com.programmersdiary.crondaemon.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRegistryTest {

    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        registry = new SessionRegistry(clock);
    }

    private Session attach(TransportKind kind, SessionTransport transport) {
        clock.advance(Duration.ofSeconds(1));
        return registry.attach(kind, kind.name().toLowerCase(), transport);
    }

    @Test
    void detach_isIdempotent() {
        var session = attach(TransportKind.TELEGRAM, text -> { });

        assertTrue(registry.detach(session.handle()));
        assertFalse(registry.detach(session.handle()));
        assertFalse(session.isAttached());
        assertEquals(0, registry.attachedCount());
    }

    @Test
    void attachingSecondTerminal_replacesTheFirst() {
        var first = attach(TransportKind.TERMINAL, text -> { });
        var second = attach(TransportKind.TERMINAL, text -> { });

        assertFalse(first.isAttached());
        assertTrue(second.isAttached());
        assertEquals(List.of(second), registry.attached(JobScope.ALL));
    }

    @Test
    void broadcast_honoursScope() {
        var terminalOut = new CopyOnWriteArrayList<String>();
        var telegramOut = new CopyOnWriteArrayList<String>();
        attach(TransportKind.TERMINAL, terminalOut::add);
        var telegram = attach(TransportKind.TELEGRAM, telegramOut::add);

        var report = registry.broadcast("hello", JobScope.TELEGRAM);

        assertEquals(List.of(telegram.handle()), report.delivered());
        assertTrue(terminalOut.isEmpty());
        assertEquals(List.of("hello"), telegramOut);
    }

    @Test
    void broadcast_withNoRecipientsReportsNothing() {
        var report = registry.broadcast("hello", JobScope.ALL);

        assertFalse(report.deliveredAnywhere());
        assertTrue(report.failed().isEmpty());
    }

    @Test
    void transientFailure_isRetriedOnce() {
        var attempts = new AtomicInteger();
        var session = attach(TransportKind.TELEGRAM, text -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DeliveryException("429 Too Many Requests", true);
            }
        });

        var report = registry.broadcast("hello", JobScope.ALL);

        assertEquals(2, attempts.get());
        assertEquals(List.of(session.handle()), report.delivered());
    }

    @Test
    void repeatedTransientFailure_givesUpAfterOneRetry() {
        var attempts = new AtomicInteger();
        var session = attach(TransportKind.TELEGRAM, text -> {
            attempts.incrementAndGet();
            throw new DeliveryException("timeout", true);
        });

        var report = registry.broadcast("hello", JobScope.ALL);

        assertEquals(2, attempts.get());
        assertEquals(List.of(session.handle()), report.failed());
        assertTrue(session.isAttached());
    }

    @Test
    void permanentFailure_isNotRetriedAndDoesNotStopOtherRecipients() {
        var attempts = new AtomicInteger();
        var received = new CopyOnWriteArrayList<String>();
        var blocked = attach(TransportKind.TELEGRAM, text -> {
            attempts.incrementAndGet();
            throw new DeliveryException("403 Forbidden: bot was blocked", false);
        });
        var crashing = attach(TransportKind.TELEGRAM, text -> {
            throw new IllegalStateException("boom");
        });
        var healthy = attach(TransportKind.TERMINAL, received::add);

        var report = registry.broadcast("hello", JobScope.ALL);

        assertEquals(1, attempts.get());
        assertEquals(List.of(blocked.handle(), crashing.handle()), report.failed());
        assertEquals(List.of(healthy.handle()), report.delivered());
        assertEquals(List.of("hello"), received);
    }

    @Test
    void sessionDetachedMidBroadcast_isSkipped() {
        var second = new AtomicReference<Session>();
        var secondOut = new CopyOnWriteArrayList<String>();
        var first = attach(TransportKind.TELEGRAM, text -> registry.detach(second.get().handle()));
        second.set(attach(TransportKind.TELEGRAM, secondOut::add));

        var report = registry.broadcast("hello", JobScope.ALL);

        assertEquals(List.of(first.handle()), report.delivered());
        assertTrue(report.failed().isEmpty());
        assertTrue(secondOut.isEmpty());
    }
}
