package com.tollgate.core.model;

/**
 * What a gate run is evaluated against.
 */
public enum TargetKind {
    TASK("task"),
    TASK_RUN("task_run"),
    SANDBOX_EXECUTION("sandbox_execution");

    private final String value;

    TargetKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
