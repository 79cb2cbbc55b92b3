package com.moneyflow.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat snapshot of named market indicators. Missing or unreadable keys resolve to the
 * caller-supplied default.
 */
public final class MarketState {

    private static final MarketState EMPTY = new MarketState(Map.of());

    private final Map<String, Object> values;

    private MarketState(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static MarketState of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return new MarketState(copy);
    }

    public static MarketState empty() {
        return EMPTY;
    }

    public MarketState merge(Map<String, ?> updates) {
        if (updates == null || updates.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        updates.forEach((key, value) -> {
            if (key == null) {
                return;
            }
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return new MarketState(merged);
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            double result = number.doubleValue();
            return Double.isNaN(result) ? defaultValue : result;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("1") || normalized.equals("yes")) {
                return true;
            }
            if (normalized.equals("false") || normalized.equals("0") || normalized.equals("no")) {
                return false;
            }
        }
        return defaultValue;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "MarketState" + values;
    }
}
