package com.folio.worker;

import com.folio.routes.Request;

import java.util.List;

/**
 * Outcome of building one request: renderer timings, wall time and errors.
 */
public record RequestTimings(Request request, List<Timing> timings, long durationNanos, List<RequestError> errors) {

    public RequestTimings {
        timings = List.copyOf(timings);
        errors = List.copyOf(errors);
    }

    public boolean succeeded() {
        return errors.isEmpty();
    }
}
