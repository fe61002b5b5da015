package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.Provenance;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HookCollectorTest {

    private final HookCollector collector = new HookCollector(HookInterface.defaults());

    private static HookDeclaration hook(String name, Provenance provenance) {
        return Fixtures.hook(HookInterface.BOOTSTRAP, name, ctx -> HookPatch.none()).withProvenance(provenance);
    }

    private static List<String> names(List<HookDeclaration> hooks) {
        return hooks.stream().map(HookDeclaration::getName).collect(Collectors.toList());
    }

    @Test
    void collect_keepsSourceOrder() {
        List<HookDeclaration> out = collector.collect(
                List.of(hook("internal", Provenance.internal())),
                List.of(hook("plugin", Provenance.plugin("p"))),
                List.of(hook("route", Provenance.route("blog"))),
                List.of(hook("project", Provenance.hooksFile())),
                List.of());

        assertEquals(List.of("internal", "plugin", "route", "project"), names(out));
    }

    @Test
    void collect_removesDisabledHooksByName() {
        List<HookDeclaration> out = collector.collect(
                List.of(hook("internal", Provenance.internal())),
                List.of(hook("slowPlugin", Provenance.plugin("p"))),
                List.of(),
                List.of(hook("project", Provenance.hooksFile())),
                List.of("slowPlugin", "internal"));

        assertEquals(List.of("project"), names(out));
    }

    @Test
    void collect_dropsHookForUnknownPoint() {
        HookDeclaration unknown = Fixtures.hook("beforeEverything", "early", ctx -> HookPatch.none())
                .withProvenance(Provenance.hooksFile());

        List<HookDeclaration> out = collector.collect(List.of(), List.of(), List.of(),
                List.of(unknown, hook("ok", Provenance.hooksFile())), List.of());

        assertEquals(List.of("ok"), names(out));
    }
}
