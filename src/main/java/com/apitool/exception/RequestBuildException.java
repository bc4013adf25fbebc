package com.apitool.exception;

/**
 * Thrown when an outbound request cannot be assembled from validated parameters, for example
 * when a path placeholder has no value or the resulting URI is malformed.
 */
public class RequestBuildException extends ToolEngineException {

    public RequestBuildException(String message) {
        super(ErrorKind.REQUEST_BUILD_ERROR, message);
    }

    public RequestBuildException(String message, Throwable cause) {
        super(ErrorKind.REQUEST_BUILD_ERROR, message, cause);
    }
}
