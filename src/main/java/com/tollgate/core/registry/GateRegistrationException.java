package com.tollgate.core.registry;

/**
 * Initialization error of the checker registry: duplicate registration,
 * registration after sealing, or a configured gate type with no checker.
 */
public class GateRegistrationException extends RuntimeException {
    public GateRegistrationException(String message) {
        super(message);
    }
}
