package com.tollgate.core.model;

/**
 * Issue severity, highest first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public String value() {
        return name().toLowerCase();
    }
}
