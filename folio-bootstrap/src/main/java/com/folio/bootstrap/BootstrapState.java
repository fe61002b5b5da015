package com.folio.bootstrap;

/**
 * Pipeline states, in order. A pipeline only moves forward, and reaches either {@link #READY} or
 * {@link #FAILED} exactly once.
 */
public enum BootstrapState {
    LOADING,
    CUSTOMIZE_HOOKS,
    BOOTSTRAP,
    ENUMERATE_REQUESTS,
    ALL_REQUESTS,
    RESOLVE_PERMALINKS,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
