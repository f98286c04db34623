package com.programmersdiary.crondaemon.session;

public enum TransportKind {
    TELEGRAM,
    TERMINAL
}
