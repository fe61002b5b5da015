package com.folio.worker;

import com.folio.bootstrap.ReadyPipeline;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;

/**
 * Renders and writes one page. Implemented outside the core (templates, file output).
 * Failures may be thrown or reported in {@link PageResult#errors()}; either way they are counted
 * against the request and the worker moves on.
 */
@FunctionalInterface
public interface PageRenderer {

    PageResult render(Request request, RouteDefinition route, ReadyPipeline pipeline) throws Exception;
}
