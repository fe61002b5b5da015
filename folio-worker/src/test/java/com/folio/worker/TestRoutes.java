package com.folio.worker;

import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;

import java.util.List;

final class TestRoutes {

    private TestRoutes() {
    }

    static RouteDefinition pages(List<Request> requests) {
        return RouteDefinition.builder()
                .all(requests)
                .permalink((r, s) -> "/" + r.getSlug())
                .template("Page.svelte")
                .build();
    }
}
