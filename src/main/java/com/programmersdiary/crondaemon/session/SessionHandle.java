package com.programmersdiary.crondaemon.session;

import java.util.UUID;

public record SessionHandle(String id) {

    public static SessionHandle random() {
        return new SessionHandle(UUID.randomUUID().toString());
    }
}
