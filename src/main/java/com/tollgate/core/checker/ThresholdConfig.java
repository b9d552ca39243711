package com.tollgate.core.checker;

import com.tollgate.core.model.Snapshots;

import java.util.List;
import java.util.Map;

/**
 * Typed view over a gate's threshold config. Every accessor names the offending
 * key in the {@link ConfigException} it throws; nothing is defaulted unless the
 * key is documented as optional.
 */
public final class ThresholdConfig {

    private final Map<String, Object> values;

    private ThresholdConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static ThresholdConfig of(Map<String, ?> values) {
        return new ThresholdConfig(Snapshots.freeze(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean requireBoolean(String key) {
        Object raw = require(key);
        if (!(raw instanceof Boolean b)) {
            throw new ConfigException(key, "expected a boolean but was " + describe(raw));
        }
        return b;
    }

    /** Optional boolean; {@code null} when absent. */
    public Boolean optionalBoolean(String key) {
        Object raw = values.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Boolean b)) {
            throw new ConfigException(key, "expected a boolean but was " + describe(raw));
        }
        return b;
    }

    public double requireNumber(String key) {
        Object raw = require(key);
        if (!(raw instanceof Number n)) {
            throw new ConfigException(key, "expected a number but was " + describe(raw));
        }
        double value = n.doubleValue();
        if (Double.isNaN(value) || value < 0) {
            throw new ConfigException(key, "must be a non-negative number but was " + raw);
        }
        return value;
    }

    public int requireNonNegativeInt(String key) {
        Object raw = require(key);
        if (!(raw instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
            throw new ConfigException(key, "expected an integer but was " + describe(raw));
        }
        if (n.longValue() < 0 || n.longValue() > Integer.MAX_VALUE) {
            throw new ConfigException(key, "must be a non-negative integer but was " + raw);
        }
        return n.intValue();
    }

    public double requirePercentage(String key) {
        double value = requireNumber(key);
        if (value > 100) {
            throw new ConfigException(key, "must be within [0, 100] but was " + value);
        }
        return value;
    }

    public List<?> requireList(String key) {
        Object raw = require(key);
        if (!(raw instanceof List<?> list)) {
            throw new ConfigException(key, "expected a list but was " + describe(raw));
        }
        return list;
    }

    private Object require(String key) {
        Object raw = values.get(key);
        if (raw == null) {
            throw new ConfigException(key, "required key is missing");
        }
        return raw;
    }

    static String describe(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName() + " '" + raw + "'";
    }

    @Override
    public String toString() {
        return "ThresholdConfig" + values;
    }
}
