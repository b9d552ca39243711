package com.tollgate.core.model;

/**
 * Thrown by collaborators (config store, artifact provider) when the environment
 * itself is unavailable, as opposed to one gate's evidence being bad.
 */
public class GateEnvironmentException extends RuntimeException {
    public GateEnvironmentException(String message) {
        super(message);
    }

    public GateEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
