package com.folio.routes;

import com.folio.errors.BootstrapException;

/**
 * A request refers to a route that does not exist (or has no permalink function), e.g. a request
 * injected by an {@code allRequests} hook with a wrong route name.
 */
public final class UnknownRouteException extends BootstrapException {

    private final String routeName;

    public UnknownRouteException(String routeName, Request request) {
        super("Route '" + routeName + "' does not exist or has no permalink function; request: "
                + (request != null ? request.toJson() : "null"));
        this.routeName = routeName;
    }

    public String getRouteName() {
        return routeName;
    }
}
