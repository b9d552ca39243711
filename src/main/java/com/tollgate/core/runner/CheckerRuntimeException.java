package com.tollgate.core.runner;

/**
 * Wraps any exception raised by a checker's {@code evaluate}. The message is
 * what ends up in the execution's {@code errorMessage}.
 */
public class CheckerRuntimeException extends RuntimeException {

    public CheckerRuntimeException(Throwable cause) {
        super(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
