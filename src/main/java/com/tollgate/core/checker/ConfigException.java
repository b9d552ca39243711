package com.tollgate.core.checker;

/**
 * Thrown when a gate's threshold config is missing a required key or holds a
 * value of the wrong type or range. Never defaulted silently.
 */
public class ConfigException extends RuntimeException {

    private final String key;

    public ConfigException(String key, String reason) {
        super("Invalid threshold config '" + key + "': " + reason);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
