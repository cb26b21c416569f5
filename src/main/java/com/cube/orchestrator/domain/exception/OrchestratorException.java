package com.cube.orchestrator.domain.exception;

/**
 * Base class for every failure the orchestrator reports to its callers.
 */
public class OrchestratorException extends RuntimeException {

    private final ErrorKind kind;

    public OrchestratorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrchestratorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
