package com.apitools.dto.response;

/**
 * The outcome of a shell command.
 *
 * @param success Whether the command did what was asked.
 * @param message Text shown to the user.
 */
public record CommandResponse(boolean success, String message) {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * The message colored green on success and red on failure.
     */
    public String toAnsiString() {
        return (success ? GREEN : RED) + message + RESET;
    }
}
