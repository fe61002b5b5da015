package com.folio.worker;

/**
 * Where a worker reports progress. Implementations must accept events from the worker thread.
 */
@FunctionalInterface
public interface ProgressChannel {

    void send(ProgressEvent event);

    /** Discards everything. */
    static ProgressChannel discarding() {
        return event -> { };
    }
}
