package com.cube.orchestrator.domain.exception;

public class QueryExecutionException extends OrchestratorException {

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorKind.QUERY_FAILED, message, cause);
    }
}
