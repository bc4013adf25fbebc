package com.apitool.exception;

import java.util.List;

/**
 * Thrown when a tool's OpenAPI document cannot be parsed or breaks the
 * single-path / single-method / single-server convention.
 */
public class InvalidSpecException extends ToolEngineException {

    public InvalidSpecException(String message) {
        super(ErrorKind.INVALID_SPEC, message);
    }

    public InvalidSpecException(List<String> violations) {
        super(ErrorKind.INVALID_SPEC, "Invalid OpenAPI specification: " + String.join("; ", violations), violations, null);
    }
}
