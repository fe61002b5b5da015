package com.folio.bootstrap;

import com.folio.config.FolioSettings;
import com.folio.config.SettingsView;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookFunction;
import com.folio.hooks.PipelineContext;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;

import java.util.List;
import java.util.Map;

final class Fixtures {

    private Fixtures() {
    }

    static RouteDefinition route(String name, List<Request> requests) {
        return RouteDefinition.builder()
                .name(name)
                .all(requests)
                .permalink((r, s) -> "/" + r.getSlug())
                .template(name + ".svelte")
                .build();
    }

    static HookDeclaration hook(String point, String name, HookFunction run) {
        return HookDeclaration.builder()
                .hook(point)
                .name(name)
                .description(name)
                .run(run)
                .build();
    }

    static PipelineContext context(FolioSettings settings, Map<String, RouteDefinition> routes) {
        return PipelineContext.builder().settings(SettingsView.of(settings)).routes(routes).build();
    }
}
