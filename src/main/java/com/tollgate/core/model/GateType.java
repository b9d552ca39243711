package com.tollgate.core.model;

import java.util.Arrays;

/**
 * The closed set of gate kinds a project can configure.
 * <p>
 * Each constant carries the lowercase wire value used in persisted configs
 * and artifact file names ({@code type_check}, not {@code TYPE_CHECK}).
 */
public enum GateType {
    LINT("lint"),
    COVERAGE("coverage"),
    SECURITY("security"),
    PERFORMANCE("performance"),
    CONTRACT("contract"),
    COMPLEXITY("complexity"),
    TYPE_CHECK("type_check");

    private final String value;

    GateType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a wire value ({@code "lint"}) or constant name ({@code "LINT"}).
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static GateType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Gate type must not be null");
        }
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(raw) || t.name().equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown gate type: " + raw));
    }
}
