package com.tollgate.core.artifact;

import com.tollgate.core.model.GateType;
import com.tollgate.core.model.Snapshots;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque per-gate-type evidence (lint findings, coverage report, scan output, latency samples...).
 * <p>
 * The evidence is a JSON-like tree. Checkers read it through the typed accessors
 * below, which raise {@link ArtifactFormatException} naming the offending field.
 *
 * @param gateType gate type this evidence was produced for
 * @param evidence frozen JSON object
 */
public record ExecutionArtifact(GateType gateType, Map<String, Object> evidence) {

    public ExecutionArtifact {
        Objects.requireNonNull(gateType, "gateType must not be null");
        evidence = Snapshots.freeze(evidence);
    }

    public static ExecutionArtifact of(GateType gateType, Map<String, ?> evidence) {
        return new ExecutionArtifact(gateType, Snapshots.freeze(evidence));
    }

    public boolean has(String field) {
        return evidence.get(field) != null;
    }

    public double requireNumber(String field) {
        return number(evidence, field, field);
    }

    public Optional<Double> optionalNumber(String field) {
        return has(field) ? Optional.of(requireNumber(field)) : Optional.empty();
    }

    /** A list of JSON objects; an absent field reads as empty. */
    public List<Map<String, Object>> objectList(String field) {
        Object raw = evidence.get(field);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ArtifactFormatException(gateType.value() + " evidence field '" + field + "' must be a list");
        }
        var items = new ArrayList<Map<String, Object>>(list.size());
        for (int i = 0; i < list.size(); i++) {
            items.add(object(list.get(i), field + "[" + i + "]"));
        }
        return items;
    }

    /** A list of numbers; an absent field reads as empty. */
    public List<Double> numberList(String field) {
        Object raw = evidence.get(field);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ArtifactFormatException(gateType.value() + " evidence field '" + field + "' must be a list");
        }
        var values = new ArrayList<Double>(list.size());
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Number n)) {
                throw new ArtifactFormatException("Evidence field '" + field + "[" + i + "]' must be a number");
            }
            values.add(n.doubleValue());
        }
        return values;
    }

    // -- item readers, used on the objects returned by objectList --

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Object raw, String path) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ArtifactFormatException("Evidence field '" + path + "' must be an object");
        }
        return (Map<String, Object>) map;
    }

    public static String string(Map<String, Object> item, String field, String path) {
        Object raw = item.get(field);
        if (!(raw instanceof String s)) {
            throw new ArtifactFormatException("Evidence field '" + path + "." + field + "' must be a string");
        }
        return s;
    }

    public static String optionalString(Map<String, Object> item, String field) {
        Object raw = item.get(field);
        return raw == null ? null : raw.toString();
    }

    public static double number(Map<String, Object> item, String field, String path) {
        Object raw = item.get(field);
        if (!(raw instanceof Number n)) {
            throw new ArtifactFormatException("Evidence field '" + path + "' must be a number");
        }
        return n.doubleValue();
    }

    public static Integer optionalInt(Map<String, Object> item, String field) {
        return item.get(field) instanceof Number n ? n.intValue() : null;
    }

    public static boolean flag(Map<String, Object> item, String field) {
        return Boolean.TRUE.equals(item.get(field));
    }

    /** {@code file:line}, {@code file}, or {@code null}. */
    public static String location(Map<String, Object> item) {
        String file = optionalString(item, "file");
        if (file == null) {
            return null;
        }
        Integer line = optionalInt(item, "line");
        return line == null ? file : file + ":" + line;
    }
}
