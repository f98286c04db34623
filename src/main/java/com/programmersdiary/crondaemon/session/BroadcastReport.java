package com.programmersdiary.crondaemon.session;

import java.util.List;

public record BroadcastReport(List<SessionHandle> delivered, List<SessionHandle> failed) {

    public static final BroadcastReport EMPTY = new BroadcastReport(List.of(), List.of());

    public boolean deliveredAnywhere() {
        return !delivered.isEmpty();
    }
}
