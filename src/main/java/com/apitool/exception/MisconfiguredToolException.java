package com.apitool.exception;

/**
 * Thrown when a tool's security option points at a scheme that does not exist, is itself
 * a {@code $ref}, or lacks the secret-type tags its type requires.
 */
public class MisconfiguredToolException extends ToolEngineException {

    public MisconfiguredToolException(String message) {
        super(ErrorKind.MISCONFIGURED_TOOL, message);
    }
}
