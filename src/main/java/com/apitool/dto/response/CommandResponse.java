package com.apitool.dto.response;

/**
 * The outcome of a shell command that does not print JSON.
 *
 * @param success Whether the command did what was asked.
 * @param message A confirmation or an error explanation.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * @return the message in green on success and red on failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
