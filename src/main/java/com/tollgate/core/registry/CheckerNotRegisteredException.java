package com.tollgate.core.registry;

import com.tollgate.core.model.GateType;

/**
 * Thrown by {@link GateRegistry#lookup(GateType)} when no checker exists for a gate type.
 */
public class CheckerNotRegisteredException extends RuntimeException {

    private final GateType gateType;

    public CheckerNotRegisteredException(GateType gateType) {
        super("No checker registered for gate type '" + gateType.value() + "'");
        this.gateType = gateType;
    }

    public GateType getGateType() {
        return gateType;
    }
}
