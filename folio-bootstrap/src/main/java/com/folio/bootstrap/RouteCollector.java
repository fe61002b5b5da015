package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.Provenance;
import com.folio.routes.RouteDataFunction;
import com.folio.routes.RouteDefinition;
import com.folio.routes.RouteValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges plugin routes with user routes. A user route replaces a plugin route of the same name; the
 * merged map keeps plugin routes first, then user routes, in declaration order. Invalid routes are
 * dropped with a warning.
 */
public final class RouteCollector {

    private static final Logger log = LoggerFactory.getLogger(RouteCollector.class);

    static final String USER_ROUTES = "routes";

    private final RouteValidator validator = new RouteValidator();

    public RouteCollection collect(Map<String, RouteDefinition> pluginRoutes, Map<String, RouteDefinition> userRoutes) {
        Map<String, RouteDefinition> merged = new LinkedHashMap<>(pluginRoutes);

        for (Map.Entry<String, RouteDefinition> e : userRoutes.entrySet()) {
            String routeName = e.getKey();
            RouteDefinition route = e.getValue();
            if (route == null) {
                log.warn("Route {} is null and will be skipped", routeName);
                continue;
            }
            RouteDefinition tagged = route.withProvenance(Provenance.route(USER_ROUTES));
            if (tagged.getName() == null) tagged = tagged.withName(routeName);
            if (tagged.getData() == null) tagged = tagged.withData(RouteDataFunction.EMPTY);
            List<HookDeclaration> hooks = new ArrayList<>();
            for (HookDeclaration hook : tagged.getHooks()) {
                if (hook != null) hooks.add(hook.withProvenance(Provenance.route(routeName)));
            }
            tagged = tagged.withHooks(hooks);
            RouteDefinition previous = merged.remove(routeName);
            if (previous != null) {
                log.debug("Route {} from {} is replaced by the user route", routeName, previous.getProvenance());
            }
            merged.put(routeName, tagged);
        }

        Map<String, RouteDefinition> valid = new LinkedHashMap<>();
        List<HookDeclaration> routeHooks = new ArrayList<>();
        for (Map.Entry<String, RouteDefinition> e : merged.entrySet()) {
            validator.validate(e.getValue(), e.getKey()).ifPresent(route -> {
                valid.put(e.getKey(), route);
                routeHooks.addAll(route.getHooks());
            });
        }
        log.debug("Collected {} route(s): {}", valid.size(), valid.keySet());
        return new RouteCollection(valid, routeHooks);
    }
}
