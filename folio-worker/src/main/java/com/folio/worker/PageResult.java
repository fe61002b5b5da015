package com.folio.worker;

import java.util.List;

/**
 * What the renderer reports for one request.
 */
public record PageResult(List<RequestError> errors, List<Timing> timings) {

    public PageResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        timings = timings != null ? List.copyOf(timings) : List.of();
    }

    public static PageResult ok() {
        return new PageResult(List.of(), List.of());
    }

    public static PageResult ok(List<Timing> timings) {
        return new PageResult(List.of(), timings);
    }

    public static PageResult failed(RequestError... errors) {
        return new PageResult(List.of(errors), List.of());
    }
}
