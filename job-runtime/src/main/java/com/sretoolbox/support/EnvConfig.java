package com.sretoolbox.support;

import java.time.Duration;
import java.util.Map;

/**
 * Typed access to environment-style settings with defaults.
 */
public class EnvConfig {
    private final Map<String, String> values;

    public EnvConfig(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static EnvConfig fromEnvironment() {
        return new EnvConfig(System.getenv());
    }

    public String get(String key, String defaultValue) {
        String v = values.get(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + v);
        }
    }

    public long getLong(String key, long defaultValue) {
        String v = get(key, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + v);
        }
    }

    public Duration getSeconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(getLong(key, defaultSeconds));
    }

    public Duration getMillis(String key, long defaultMillis) {
        return Duration.ofMillis(getLong(key, defaultMillis));
    }
}
