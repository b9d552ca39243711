package com.tollgate.core.runner;

import com.tollgate.core.model.GateType;

import java.time.Duration;

/**
 * A gate's evaluation exceeded its timeout and was cancelled.
 */
public class EvaluationTimeoutException extends RuntimeException {

    private final GateType gateType;
    private final Duration timeout;

    public EvaluationTimeoutException(GateType gateType, Duration timeout) {
        super("Gate '" + gateType.value() + "' exceeded timeout of " + timeout.toSeconds() + "s");
        this.gateType = gateType;
        this.timeout = timeout;
    }

    public GateType getGateType() {
        return gateType;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
