package com.cube.orchestrator.domain.exception;

/**
 * The result is still being processed; the caller should ask again.
 */
public class ContinueWaitException extends OrchestratorException {

    private final String queryKey;

    public ContinueWaitException(String queryKey) {
        super(ErrorKind.CONTINUE_WAIT, "Continue wait");
        this.queryKey = queryKey;
    }

    public String getQueryKey() {
        return queryKey;
    }
}
