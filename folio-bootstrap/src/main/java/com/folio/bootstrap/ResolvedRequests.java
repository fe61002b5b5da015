package com.folio.bootstrap;

import com.folio.routes.Request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requests with permalinks and types assigned, plus the permalink index used when serving (empty outside
 * server context).
 */
public record ResolvedRequests(List<Request> requests, Map<String, Request> serverLookup) {

    public ResolvedRequests {
        requests = List.copyOf(requests);
        serverLookup = Collections.unmodifiableMap(new LinkedHashMap<>(serverLookup));
    }
}
