package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque key-value payload of a job. Only the matching task handler interprets it.
 */
public final class JobConfig implements Serializable {
    private static final JobConfig EMPTY = new JobConfig(Map.of());

    private final LinkedHashMap<String, Object> values;

    // Used by Kryo
    private JobConfig() {
        this.values = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public JobConfig(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values != null ? values : Map.of());
    }

    public static JobConfig empty() {
        return EMPTY;
    }

    public static JobConfig of(String key, Object value) {
        return empty().with(key, value);
    }

    /**
     * Returns a copy with the given entry added or replaced.
     */
    public JobConfig with(String key, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new JobConfig(copy);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Read an integer, accepting numbers and numeric strings.
     *
     * @throws IllegalArgumentException if the value is present but not numeric
     */
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config value '" + key + "' is not a number: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Read a list of strings. A single scalar value is returned as a one-element list.
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Iterable) {
            List<String> result = new ArrayList<>();
            for (Object item : (Iterable<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of(value.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) value);
        }
        return Map.of();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobConfig)) return false;
        return values.equals(((JobConfig) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "JobConfig" + values;
    }
}
