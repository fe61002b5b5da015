package com.folio.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigMergeTest {

    @Test
    void defaultsDeep_keepsOverridesAndFillsMissingKeysRecursively() {
        Map<String, Object> defaults = Map.of(
                "limit", 10,
                "feed", Map.of("enabled", false, "path", "/rss.xml"));
        Map<String, Object> user = Map.of("feed", Map.of("enabled", true));

        Map<String, Object> merged = ConfigMerge.defaultsDeep(user, defaults);

        assertEquals(10, merged.get("limit"));
        assertEquals(Map.of("enabled", true, "path", "/rss.xml"), merged.get("feed"));
    }

    @Test
    void defaultsDeep_explicitNullIsKept() {
        Map<String, Object> user = new HashMap<>();
        user.put("limit", null);

        Map<String, Object> merged = ConfigMerge.defaultsDeep(user, Map.of("limit", 5, "page", 1));

        assertTrue(merged.containsKey("limit"));
        assertNull(merged.get("limit"));
        assertEquals(1, merged.get("page"));
    }

    @Test
    void defaultsDeep_doesNotModifyInputs() {
        Map<String, Object> defaults = new HashMap<>(Map.of("a", 1));
        Map<String, Object> user = new HashMap<>(Map.of("b", 2));

        ConfigMerge.defaultsDeep(user, defaults);

        assertEquals(Map.of("a", 1), defaults);
        assertEquals(Map.of("b", 2), user);
    }
}
