package com.programmersdiary.crondaemon.scheduling;

/**
 * A job before the store assigns its id and creation time.
 */
public record JobDraft(
        JobScope scope,
        String cronExpression,
        String task,
        String message,
        String createdBy) {
}
