package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;
import com.folio.routes.RouteDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged, validated routes plus the inline hooks declared by user routes.
 */
public record RouteCollection(Map<String, RouteDefinition> routes, List<HookDeclaration> routeHooks) {

    public RouteCollection {
        routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        routeHooks = List.copyOf(routeHooks);
    }
}
