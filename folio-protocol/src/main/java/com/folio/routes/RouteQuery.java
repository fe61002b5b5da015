package com.folio.routes;

import com.folio.config.SettingsView;

import java.util.Map;

/**
 * What a route's {@link RequestSource} can see when it enumerates requests.
 */
public record RouteQuery(SettingsView settings, Map<String, Object> data, Map<String, Object> query,
                         PermalinkHelper helpers) {

    public RouteQuery {
        data = data != null ? data : Map.of();
        query = query != null ? query : Map.of();
    }
}
