package com.programmersdiary.crondaemon.web;

public record CreateJobRequest(String cronExpression, String task, String message, String scope) {
}
