package com.programmersdiary.crondaemon.session;

import com.programmersdiary.crondaemon.scheduling.JobScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the interfaces currently connected to the daemon and fans scheduled output out to them.
 *
 * <p>At most one terminal session is attached at a time; attaching a new one detaches the old one.
 * Broadcasts work on a snapshot and never throw: a recipient that fails is dropped from that broadcast
 * only and stays attached.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<SessionHandle, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public synchronized Session attach(TransportKind kind, String lineage, SessionTransport transport) {
        if (kind == TransportKind.TERMINAL) {
            sessions.values().stream()
                    .filter(s -> s.kind() == TransportKind.TERMINAL)
                    .toList()
                    .forEach(s -> detach(s.handle()));
        }
        var session = new Session(SessionHandle.random(), kind, lineage, transport, clock.instant());
        sessions.put(session.handle(), session);
        log.info("Attached session {}", session);
        return session;
    }

    public synchronized boolean detach(SessionHandle handle) {
        var session = sessions.remove(handle);
        if (session == null) {
            return false;
        }
        session.markDetached(clock.instant());
        log.info("Detached session {}", session);
        return true;
    }

    public Optional<Session> find(SessionHandle handle) {
        return Optional.ofNullable(sessions.get(handle));
    }

    /**
     * Attached sessions whose transport kind is covered by the scope, oldest first.
     */
    public List<Session> attached(JobScope scope) {
        return sessions.values().stream()
                .filter(s -> scope.includes(s.kind()))
                .sorted(Comparator.comparing(Session::attachedAt))
                .toList();
    }

    public int attachedCount() {
        return sessions.size();
    }

    public BroadcastReport broadcast(String text, JobScope scope) {
        var recipients = attached(scope);
        if (recipients.isEmpty()) {
            return BroadcastReport.EMPTY;
        }
        var delivered = new ArrayList<SessionHandle>();
        var failed = new ArrayList<SessionHandle>();
        for (var session : recipients) {
            if (!session.isAttached()) {
                continue;
            }
            if (deliver(session, text)) {
                delivered.add(session.handle());
            } else {
                failed.add(session.handle());
            }
        }
        return new BroadcastReport(List.copyOf(delivered), List.copyOf(failed));
    }

    private boolean deliver(Session session, String text) {
        try {
            session.transport().send(text);
            return true;
        } catch (DeliveryException e) {
            if (!e.isTransient()) {
                log.warn("Delivery to {} failed: {}", session, e.getMessage());
                return false;
            }
            return retryOnce(session, text, e);
        } catch (RuntimeException e) {
            log.warn("Delivery to {} failed unexpectedly", session, e);
            return false;
        }
    }

    private boolean retryOnce(Session session, String text, DeliveryException first) {
        if (!session.isAttached()) {
            return false;
        }
        try {
            session.transport().send(text);
            return true;
        } catch (DeliveryException | RuntimeException e) {
            log.warn("Delivery to {} failed after retry: {} (first attempt: {})",
                    session, e.getMessage(), first.getMessage());
            return false;
        }
    }
}
