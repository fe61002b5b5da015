package com.folio.bootstrap;

import com.folio.config.BuildContext;
import com.folio.config.SettingsView;
import com.folio.routes.DuplicatePermalinkException;
import com.folio.routes.PermalinkHelper;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;
import com.folio.routes.UnknownRouteException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns each request its permalink and type, and rejects the first permalink produced twice.
 */
public final class PermalinkResolver {

    /**
     * @throws UnknownRouteException       if a request names a route that does not exist
     * @throws DuplicatePermalinkException on the first collision, carrying both requests
     */
    public ResolvedRequests resolve(List<Request> requests, Map<String, RouteDefinition> routes, SettingsView settings) {
        BuildContext context = settings.getContext();
        List<Request> resolved = new ArrayList<>(requests.size());
        Map<String, Request> byPermalink = new HashMap<>();
        Map<String, Request> serverLookup = new LinkedHashMap<>();

        for (Request request : requests) {
            RouteDefinition route = request.getRoute() != null ? routes.get(request.getRoute()) : null;
            if (route == null || route.getPermalink() == null) {
                throw new UnknownRouteException(request.getRoute(), request);
            }
            String permalink = PermalinkHelper.resolve(route, request, settings);
            Request done = request.withPermalink(permalink).withType(context);

            Request existing = byPermalink.putIfAbsent(permalink, done);
            if (existing != null) {
                throw new DuplicatePermalinkException(permalink, existing, done);
            }
            if (context == BuildContext.SERVER) {
                serverLookup.put(permalink, done);
            }
            resolved.add(done);
        }
        return new ResolvedRequests(resolved, serverLookup);
    }
}
