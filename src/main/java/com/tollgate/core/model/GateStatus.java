package com.tollgate.core.model;

/**
 * Lifecycle of a {@link GateExecution}.
 * <p>
 * {@code PENDING -> RUNNING -> terminal}. {@code SKIPPED} may also be entered
 * directly from {@code PENDING} (dry runs and runs aborted while the gate was queued).
 * Nothing leaves a terminal state.
 */
public enum GateStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    WARNING,
    SKIPPED,
    ERROR,
    TIMEOUT;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** Counted into {@code passed_evaluations}. */
    public boolean countsAsPassed() {
        return this == PASSED || this == WARNING;
    }

    /** Counted into {@code failed_evaluations}; blocks the release when the gate is blocking. */
    public boolean countsAsFailed() {
        return this == FAILED || this == ERROR || this == TIMEOUT;
    }

    public String value() {
        return name().toLowerCase();
    }
}
