package com.cube.orchestrator.domain.exception;

import java.time.Duration;

/**
 * A queue item ran out of time: it ran too long, nobody polled it, or its worker went silent.
 */
public class QueryTimeoutException extends OrchestratorException {

    public enum TimeoutType {
        EXECUTION,
        ORPHANED,
        HEARTBEAT
    }

    private final TimeoutType type;

    public QueryTimeoutException(String queryKey, TimeoutType type, Duration limit) {
        super(ErrorKind.TIMEOUT, describe(queryKey, type, limit));
        this.type = type;
    }

    public TimeoutType getType() {
        return type;
    }

    private static String describe(String queryKey, TimeoutType type, Duration limit) {
        switch (type) {
            case EXECUTION:
                return "Query " + queryKey + " exceeded execution timeout of " + limit.toSeconds() + "s";
            case ORPHANED:
                return "Query " + queryKey + " was not polled for " + limit.toSeconds() + "s and was cancelled as orphaned";
            default:
                return "Query " + queryKey + " worker missed heartbeats for " + limit.toSeconds() + "s";
        }
    }
}
