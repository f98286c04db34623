package com.programmersdiary.crondaemon.scheduling;

public class InvalidScheduleException extends IllegalArgumentException {

    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
