package com.geotracking.engine.exception;

/**
 * A storage collaborator call failed. Always retryable from the engine's point of view.
 */
public class PersistenceFailureException extends RuntimeException {

    private final String operation;

    public PersistenceFailureException(String operation, Throwable cause) {
        super(String.format("Persistence operation '%s' failed: %s", operation,
            cause != null ? cause.getMessage() : "unknown error"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
