package com.cube.orchestrator.domain.exception;

public class PartitionsNotReadyException extends OrchestratorException {

    public PartitionsNotReadyException(String message) {
        super(ErrorKind.NOT_READY, message);
    }
}
