package com.cube.orchestrator.domain.exception;

/**
 * Internal signal: the compiled data model is out of date for the current request.
 * Never surfaced to API callers; the request is retried after recompilation.
 */
public class RecompileRequiredException extends OrchestratorException {

    public RecompileRequiredException(String message) {
        super(ErrorKind.RECOMPILE_REQUIRED, message);
    }
}
