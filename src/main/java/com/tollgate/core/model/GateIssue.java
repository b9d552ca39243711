package com.tollgate.core.model;

import java.util.Objects;

/**
 * A single finding reported by a checker.
 *
 * @param severity how serious the finding is
 * @param message  human-readable description
 * @param location file/line, package, or endpoint the finding points at (nullable)
 */
public record GateIssue(
    Severity severity,
    String message,
    String location
) {

    public GateIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static GateIssue of(Severity severity, String message) {
        return new GateIssue(severity, message, null);
    }
}
