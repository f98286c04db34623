package com.programmersdiary.crondaemon.scheduling;

import com.programmersdiary.crondaemon.session.TransportKind;

import java.util.Locale;

/**
 * Which attached sessions receive the output of a fire.
 */
public enum JobScope {
    ALL,
    TELEGRAM,
    TERMINAL;

    public boolean includes(TransportKind kind) {
        return this == ALL || name().equals(kind.name());
    }

    public static JobScope parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scope: " + value + " (expected all, telegram or terminal)", e);
        }
    }
}
