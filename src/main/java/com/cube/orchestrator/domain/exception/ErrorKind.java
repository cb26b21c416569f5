package com.cube.orchestrator.domain.exception;

/**
 * Failure categories surfaced by the orchestrator.
 *
 * Retryable kinds mean "temporarily degraded, try again"; the rest are
 * rejections by policy or configuration and must not be retried as-is.
 */
public enum ErrorKind {
    AUTH_DENIED(false),
    CAPACITY_EXCEEDED(false),
    NO_MATCHING_ROLLUP(false),
    TIMEOUT(true),
    CANCELLED(true),
    DRIVER_CONFIG_ERROR(false),
    RECOMPILE_REQUIRED(true),
    CONTINUE_WAIT(true),
    NOT_READY(true),
    QUERY_FAILED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
