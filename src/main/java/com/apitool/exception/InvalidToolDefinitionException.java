package com.apitool.exception;

import java.util.List;

/**
 * Thrown by tool registration when the submitted definition has one or more problems.
 * All problems are collected before throwing so that the author can fix them in one pass.
 */
public class InvalidToolDefinitionException extends ToolEngineException {

    public InvalidToolDefinitionException(List<String> problems) {
        super(ErrorKind.INVALID_SPEC, "Invalid tool definition: " + String.join("; ", problems), problems, null);
    }
}
