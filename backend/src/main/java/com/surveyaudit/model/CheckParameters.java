package com.surveyaudit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * 检查项参数快照（阈值、字段绑定等）。深度不可变，键按字典序排列。
 */
public final class CheckParameters {

    private static final CheckParameters EMPTY = new CheckParameters(Map.of());

    private final Map<String, Object> values;

    private CheckParameters(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator
    public static CheckParameters of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new CheckParameters(freezeMap(values));
    }

    public static CheckParameters empty() {
        return EMPTY;
    }

    /**
     * 以当前参数为基础覆盖部分键，返回新快照
     */
    public CheckParameters merge(Map<String, ?> overrides) {
        Map<String, Object> merged = new TreeMap<>(values);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return of(merged);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean contains(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Double.parseDouble(s.trim());
        }
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Integer.parseInt(s.trim());
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Long.parseLong(s.trim());
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : v.toString();
    }

    public List<String> getStringList(String key) {
        Object v = values.get(key);
        if (v instanceof Collection<?> c) {
            return c.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Arrays.stream(s.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
        }
        return List.of();
    }

    public Map<String, Object> getMap(String key) {
        Object v = values.get(key);
        return v instanceof Map<?, ?> m ? freezeMap(m) : Map.of();
    }

    public List<Map<String, Object>> getMapList(String key) {
        Object v = values.get(key);
        if (v instanceof Collection<?> c) {
            return c.stream()
                    .filter(e -> e instanceof Map<?, ?>)
                    .map(e -> freezeMap((Map<?, ?>) e))
                    .toList();
        }
        return List.of();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> m) {
        Map<String, Object> copy = new TreeMap<>();
        m.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            return freezeMap(m);
        }
        if (value instanceof Collection<?> c) {
            List<Object> copy = new ArrayList<>(c.size());
            c.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CheckParameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
