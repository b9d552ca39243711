package com.tollgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, order-preserving, unmodifiable copies of JSON-like maps and lists.
 * Null values are kept (unlike {@link Map#copyOf}).
 */
public final class Snapshots {

    private Snapshots() {}

    public static Map<String, Object> freeze(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    public static List<Object> freezeList(List<?> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        var copy = new ArrayList<Object>(source.size());
        for (Object value : source) {
            copy.add(freezeValue(value));
        }
        return Collections.unmodifiableList(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            return freezeList(list);
        }
        return value;
    }
}
