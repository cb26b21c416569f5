package com.cube.orchestrator.domain.exception;

public class AuthDeniedException extends OrchestratorException {

    public AuthDeniedException(String message) {
        super(ErrorKind.AUTH_DENIED, message);
    }
}
