package com.cube.orchestrator.domain.exception;

public class DriverConfigException extends OrchestratorException {

    public DriverConfigException(String message) {
        super(ErrorKind.DRIVER_CONFIG_ERROR, message);
    }

    public DriverConfigException(String message, Throwable cause) {
        super(ErrorKind.DRIVER_CONFIG_ERROR, message, cause);
    }
}
