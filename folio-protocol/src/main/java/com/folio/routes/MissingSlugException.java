package com.folio.routes;

import com.folio.errors.BootstrapException;

/**
 * A request produced by a route has no slug.
 */
public final class MissingSlugException extends BootstrapException {

    private final String routeName;

    public MissingSlugException(String routeName, Request request) {
        super("Request for route '" + routeName + "' is missing a slug: " + (request != null ? request.toJson() : "null"));
        this.routeName = routeName;
    }

    public String getRouteName() {
        return routeName;
    }
}
