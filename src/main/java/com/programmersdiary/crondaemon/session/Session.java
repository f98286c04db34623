package com.programmersdiary.crondaemon.session;

import java.time.Instant;

public final class Session {

    private final SessionHandle handle;
    private final TransportKind kind;
    private final String lineage;
    private final SessionTransport transport;
    private final Instant attachedAt;
    private volatile Instant detachedAt;

    Session(SessionHandle handle, TransportKind kind, String lineage, SessionTransport transport, Instant attachedAt) {
        this.handle = handle;
        this.kind = kind;
        this.lineage = lineage;
        this.transport = transport;
        this.attachedAt = attachedAt;
    }

    public SessionHandle handle() {
        return handle;
    }

    public TransportKind kind() {
        return kind;
    }

    /**
     * Key of the conversation this session reads and writes. Sessions sharing a lineage share history.
     */
    public String lineage() {
        return lineage;
    }

    SessionTransport transport() {
        return transport;
    }

    public Instant attachedAt() {
        return attachedAt;
    }

    public boolean isAttached() {
        return detachedAt == null;
    }

    void markDetached(Instant at) {
        detachedAt = at;
    }

    @Override
    public String toString() {
        return kind + "[" + handle.id() + ", lineage=" + lineage + "]";
    }
}
