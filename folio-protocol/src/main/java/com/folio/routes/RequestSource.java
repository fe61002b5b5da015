package com.folio.routes;

import java.util.List;

/**
 * A route's {@code all}: returns every request the route produces. Returning {@code null} is a fatal
 * bootstrap error naming the route.
 */
@FunctionalInterface
public interface RequestSource {

    List<Request> all(RouteQuery query) throws Exception;

    /** Source that always returns the given literal list. */
    static RequestSource literal(List<Request> requests) {
        List<Request> copy = requests != null ? List.copyOf(requests) : null;
        return q -> copy;
    }
}
