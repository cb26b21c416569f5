package com.cube.orchestrator.domain.exception;

public class QueryCancelledException extends OrchestratorException {

    public QueryCancelledException(String queryKey) {
        super(ErrorKind.CANCELLED, "Query " + queryKey + " was cancelled");
    }
}
