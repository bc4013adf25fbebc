package com.apitool.exception;

public class DuplicateToolException extends ToolEngineException {

    public DuplicateToolException(String name, String utilityProvider, String existingId) {
        super(ErrorKind.CONFLICT, "A tool named '" + name + "' already exists for provider '" + utilityProvider
                + "' (id " + existingId + ").");
    }
}
