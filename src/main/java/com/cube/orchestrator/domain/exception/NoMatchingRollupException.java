package com.cube.orchestrator.domain.exception;

public class NoMatchingRollupException extends OrchestratorException {

    public NoMatchingRollupException(String message) {
        super(ErrorKind.NO_MATCHING_ROLLUP, message);
    }
}
