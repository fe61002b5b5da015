package com.folio.bootstrap;

import com.folio.hooks.PipelineContext;
import com.folio.routes.InvalidRequestsException;
import com.folio.routes.MissingSlugException;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;
import com.folio.routes.RouteQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Calls every route's {@code all} with the data and query handles built during bootstrap and tags each
 * returned request with its route name. Routes are visited in merge order.
 */
public final class RequestEnumerator {

    private static final Logger log = LoggerFactory.getLogger(RequestEnumerator.class);

    /**
     * @throws InvalidRequestsException if a route returns no list or its {@code all} throws
     * @throws MissingSlugException     if a returned request has no slug
     */
    public List<Request> enumerate(PipelineContext context) {
        RouteQuery query = new RouteQuery(context.getSettings(), context.getData(), context.getQuery(),
                context.getHelpers());
        List<Request> out = new ArrayList<>();
        for (Map.Entry<String, RouteDefinition> e : context.getRoutes().entrySet()) {
            String routeName = e.getKey();
            List<Request> requests;
            try {
                requests = e.getValue().getAll().all(query);
            } catch (Exception ex) {
                throw new InvalidRequestsException(routeName, ex);
            }
            if (requests == null) {
                throw new InvalidRequestsException(routeName);
            }
            for (Request request : requests) {
                if (request == null || !request.hasSlug()) {
                    throw new MissingSlugException(routeName, request);
                }
                out.add(request.withRoute(routeName));
            }
            log.debug("Route {} produced {} request(s)", routeName, requests.size());
        }
        return out;
    }
}
