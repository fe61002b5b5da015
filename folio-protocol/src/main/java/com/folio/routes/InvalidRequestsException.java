package com.folio.routes;

import com.folio.errors.BootstrapException;

/**
 * A route's {@code all} did not return a list of requests.
 */
public final class InvalidRequestsException extends BootstrapException {

    private final String routeName;

    public InvalidRequestsException(String routeName) {
        super("Route '" + routeName + "': all() isn't returning a list of requests");
        this.routeName = routeName;
    }

    public InvalidRequestsException(String routeName, Throwable cause) {
        super("Route '" + routeName + "': all() failed: " + cause.getMessage(), cause);
        this.routeName = routeName;
    }

    public String getRouteName() {
        return routeName;
    }
}
