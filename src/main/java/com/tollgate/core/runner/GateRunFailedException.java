package com.tollgate.core.runner;

import com.tollgate.core.model.RunResult;

/**
 * Raised by a run when its environment failed (store or artifact provider down).
 * Executions that reached a terminal status before the fault are preserved in
 * {@link #getPartialResult()}.
 */
public class GateRunFailedException extends RuntimeException {

    private final transient RunResult partialResult;

    public GateRunFailedException(String message, RunResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public RunResult getPartialResult() {
        return partialResult;
    }
}
