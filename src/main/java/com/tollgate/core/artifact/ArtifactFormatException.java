package com.tollgate.core.artifact;

/**
 * Thrown when an evidence bundle is missing, lacks a required field, or holds an ill-typed value.
 */
public class ArtifactFormatException extends RuntimeException {
    public ArtifactFormatException(String message) {
        super(message);
    }

    public ArtifactFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
