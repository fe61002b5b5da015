package com.folio.routes;

import com.folio.config.SettingsView;

import java.util.Map;

/**
 * A route's {@code data}: per-request data handed to the renderer. Not run by the core pipeline.
 */
@FunctionalInterface
public interface RouteDataFunction {

    /** Returns no data. Default for routes that declare none. */
    RouteDataFunction EMPTY = (request, data, settings) -> Map.of();

    Map<String, Object> data(Request request, Map<String, Object> data, SettingsView settings) throws Exception;
}
