package com.folio.routes;

import com.folio.config.BuildContext;
import com.folio.config.SettingsView;

import java.util.Map;
import java.util.Objects;

/**
 * Computes permalinks the same way bootstrap does: the route's permalink function, prefixed with the
 * server prefix in {@link BuildContext#SERVER} context. Exposed to hooks and routes as {@code helpers}
 * so links between pages match the resolved output paths.
 */
public final class PermalinkHelper {

    private final Map<String, RouteDefinition> routes;
    private final SettingsView settings;

    public PermalinkHelper(Map<String, RouteDefinition> routes, SettingsView settings) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Permalink of a request on the named route.
     *
     * @throws UnknownRouteException if no such route exists
     */
    public String permalink(String routeName, Request request) {
        RouteDefinition route = routes.get(routeName);
        if (route == null || route.getPermalink() == null) {
            throw new UnknownRouteException(routeName, request);
        }
        return resolve(route, request.withRoute(routeName), settings);
    }

    /** Shorthand for a request that only has a slug. */
    public String permalink(String routeName, String slug) {
        return permalink(routeName, Request.of(slug));
    }

    /** Permalink of {@code request} on {@code route}, with the server prefix applied when serving. */
    public static String resolve(RouteDefinition route, Request request, SettingsView settings) {
        String permalink = route.getPermalink().permalink(request, settings);
        String prefix = settings.getServerPrefix();
        if (settings.getContext() == BuildContext.SERVER && prefix != null && !prefix.isEmpty()) {
            return prefix + permalink;
        }
        return permalink;
    }
}
