package com.folio.config;

import java.util.Locale;

/**
 * Context the pipeline runs in. Drives request typing, server-prefixing of permalinks
 * and whether a permalink lookup table is maintained.
 */
public enum BuildContext {
    /** Serving requests on demand (permalinks indexed, server prefix applied). */
    SERVER,
    /** Static build of every request. */
    BUILD,
    /** Neither (e.g. tests or tooling). */
    UNKNOWN;

    /** Lower-case name used in logs and serialized payloads (e.g. "server"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a context name; null, blank or unrecognized values map to {@link #UNKNOWN}. */
    public static BuildContext fromName(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return BuildContext.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
