package com.vigil.check;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, read-only view over a check's configuration map.
 * <p>
 * Configuration arrives from JSON, so numbers may be any {@link Number} subtype or a numeric string,
 * and booleans may be {@code "true"}/{@code "false"} strings. A value of the wrong shape raises
 * {@link IllegalArgumentException} naming the key; the check invoker turns that into an error
 * outcome.
 */
public final class CheckConfig {

    private static final CheckConfig EMPTY = new CheckConfig(Map.of());

    private final Map<String, Object> values;

    private CheckConfig(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Wraps a configuration map. Null becomes an empty configuration; null values are kept.
     */
    public static CheckConfig of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new CheckConfig(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /** Returns an empty configuration. */
    public static CheckConfig empty() {
        return EMPTY;
    }

    /** True if the key is present with a non-null value. */
    public boolean has(String key) {
        return values.get(key) != null;
    }

    /** Returns the raw value, if present and non-null. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns a required string value.
     *
     * @throws IllegalArgumentException if the key is missing or blank
     */
    public String require(String key) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required configuration: " + key);
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    public int getInt(String key, int defaultValue) {
        Number number = number(key);
        if (number == null) {
            return defaultValue;
        }
        if (number.doubleValue() != Math.rint(number.doubleValue())) {
            throw invalid(key, "an integer");
        }
        return number.intValue();
    }

    public long getLong(String key, long defaultValue) {
        Number number = number(key);
        return number == null ? defaultValue : number.longValue();
    }

    public double getDouble(String key, double defaultValue) {
        Number number = number(key);
        return number == null ? defaultValue : number.doubleValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw invalid(key, "a boolean");
    }

    /**
     * Returns a duration given in (possibly fractional) seconds.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        Number number = number(key);
        if (number == null) {
            return defaultValue;
        }
        if (number.doubleValue() < 0) {
            throw invalid(key, "a non-negative number of seconds");
        }
        return Duration.ofNanos(Math.round(number.doubleValue() * 1_000_000_000L));
    }

    /**
     * Returns a list of strings. A single string value is treated as a one-element list.
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
            return List.copyOf(result);
        }
        if (value instanceof String text) {
            return List.of(text);
        }
        throw invalid(key, "a list of strings");
    }

    /**
     * Returns a nested map with string keys, or an empty map.
     */
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return Collections.unmodifiableMap(result);
        }
        throw invalid(key, "an object");
    }

    /** Returns the underlying (unmodifiable) map. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "CheckConfig" + values.keySet();
    }

    private Number number(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number;
        }
        try {
            return Double.valueOf(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw invalid(key, "a number");
        }
    }

    private static IllegalArgumentException invalid(String key, String expected) {
        return new IllegalArgumentException("Invalid value for config key " + key + ": expected " + expected);
    }
}
