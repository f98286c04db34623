package com.programmersdiary.crondaemon.scheduling;

public enum SchedulerState {
    IDLE,
    EVALUATING,
    AWAITING_EXECUTORS
}
