package com.apitool.exception;

/**
 * Classifies every failure the engine can report to a caller.
 * <p>
 * The first three kinds describe a broken tool definition and are never something the
 * caller can fix by changing its input. {@link #VALIDATION_ERROR} is caller-fixable,
 * {@link #UPSTREAM_ERROR} comes from the invoked API, and {@link #ORCHESTRATION_ERROR}
 * is anything unexpected caught at the top of the pipeline. {@link #CONFLICT} rejects a
 * registration that would duplicate an existing tool.
 */
public enum ErrorKind {

    INVALID_SPEC(500),
    MISCONFIGURED_TOOL(500),
    UNSUPPORTED_SCHEME(500),
    VALIDATION_ERROR(400),
    REQUEST_BUILD_ERROR(500),
    UPSTREAM_ERROR(502),
    TOOL_NOT_FOUND(404),
    CONFLICT(409),
    ORCHESTRATION_ERROR(500);

    private final int defaultStatus;

    ErrorKind(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    /**
     * @return the HTTP-equivalent status reported when no upstream status is available.
     */
    public int defaultStatus() {
        return defaultStatus;
    }

    /**
     * @return {@code true} for kinds caused by the tool definition rather than the caller or the upstream API.
     */
    public boolean isConfigurationError() {
        return this == INVALID_SPEC || this == MISCONFIGURED_TOOL || this == UNSUPPORTED_SCHEME;
    }
}
