package com.folio.hooks;

/**
 * Where a hook or route came from.
 */
public enum SourceType {
    /** Built into folio. */
    INTERNAL,
    /** Contributed by a plugin. */
    PLUGIN,
    /** Declared by a user route (inline hooks or the route itself). */
    ROUTE,
    /** Project-level hooks file. */
    HOOKS_FILE
}
