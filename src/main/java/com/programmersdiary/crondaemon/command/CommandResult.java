package com.programmersdiary.crondaemon.command;

public record CommandResult(boolean success, String output) {

    public static CommandResult success(String output) {
        return new CommandResult(true, output);
    }

    public static CommandResult failure(String output) {
        return new CommandResult(false, output);
    }
}
