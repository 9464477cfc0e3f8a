package com.di.migrationplanner.estimation;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single named input to a {@link Calculator}. The value is whatever the caller supplied
 * (JSON number, Integer, Double, String...); {@link ParamValues} is the only place that turns it
 * into a number.
 */
@Value
public class Param {

    @NonNull
    String key;
    Object value;

    public static Param of(String key, Object value) {
        return new Param(key, value);
    }

    /**
     * Builds a parameter registry from raw key/value pairs (e.g. a JSON request body).
     * Null keys are dropped; the returned map is unmodifiable.
     */
    public static Map<String, Param> registryOf(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Param> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null) {
                out.put(k, new Param(k, v));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    /** Convenience for tests and programmatic callers: {@code registry(Param.of(..), Param.of(..))}. */
    public static Map<String, Param> registry(Param... params) {
        Map<String, Param> out = new LinkedHashMap<>();
        for (Param p : params) {
            out.put(p.getKey(), p);
        }
        return Collections.unmodifiableMap(out);
    }
}
