package com.apitool.exception;

import java.util.List;

/**
 * Base runtime exception for classified failures raised inside the tool execution engine.
 * <p>
 * Each instance carries an {@link ErrorKind} so that the orchestrator can turn it into a
 * structured failure outcome without inspecting the concrete subclass, plus an optional
 * list of detail messages (for example every problem found in a tool definition).
 */
public class ToolEngineException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> details;

    /**
     * Constructs a new ToolEngineException with the given kind and detail message.
     *
     * @param kind    The classification of the failure.
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public ToolEngineException(ErrorKind kind, String message) {
        this(kind, message, List.of(), null);
    }

    /**
     * Constructs a new ToolEngineException with the given kind, detail message and cause.
     *
     * @param kind    The classification of the failure.
     * @param message The detail message.
     * @param cause   The cause. A {@code null} value is permitted, and indicates that the
     *                cause is nonexistent or unknown.
     */
    public ToolEngineException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, List.of(), cause);
    }

    /**
     * Constructs a new ToolEngineException that reports several problems at once.
     *
     * @param kind    The classification of the failure.
     * @param message A summary message.
     * @param details The individual problems; never {@code null}.
     * @param cause   The cause, or {@code null}.
     */
    public ToolEngineException(ErrorKind kind, String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getDetails() {
        return details;
    }

    public int getStatusCode() {
        return kind.defaultStatus();
    }
}
