package com.folio.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merging of nested configuration maps.
 */
public final class ConfigMerge {

    private ConfigMerge() {
    }

    /**
     * Deep "defaults" merge: every key of {@code overrides} is kept; keys only present in {@code defaults}
     * are filled in. A key the user set to {@code null} stays {@code null}. Nested maps on both sides are merged recursively. Neither input is modified.
     *
     * @param overrides user-supplied values (may be null)
     * @param defaults  default values (may be null)
     * @return new merged map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> defaultsDeep(Map<String, ?> overrides, Map<String, ?> defaults) {
        Map<String, Object> out = ReadOnlyCollections.deepCopy(overrides);
        if (defaults == null) return out;
        for (Map.Entry<String, ?> e : defaults.entrySet()) {
            Object current = out.get(e.getKey());
            Object fallback = e.getValue();
            if (!out.containsKey(e.getKey())) {
                out.put(e.getKey(), fallback instanceof Map
                        ? ReadOnlyCollections.deepCopy((Map<String, ?>) fallback)
                        : fallback);
            } else if (current instanceof Map && fallback instanceof Map) {
                out.put(e.getKey(), defaultsDeep((Map<String, ?>) current, (Map<String, ?>) fallback));
            }
        }
        return out;
    }

    /** Shallow copy preserving insertion order; null → empty map. */
    public static Map<String, Object> copyOf(Map<String, ?> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }
}
