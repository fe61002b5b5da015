package com.folio.bootstrap;

import com.folio.config.BuildContext;
import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.HookPoint;
import com.folio.hooks.HookSlot;
import com.folio.plugin.PluginCatalog;
import com.folio.plugin.PluginDefinition;
import com.folio.plugin.PluginHookDeclaration;
import com.folio.plugin.PluginHookResult;
import com.folio.plugin.PluginNotFoundException;
import com.folio.plugin.PluginProvider;
import com.folio.routes.DuplicatePermalinkException;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BootstrapSequencerTest {

    @TempDir
    Path root;

    private LoadedPipeline load(FolioSettings settings, PluginCatalog catalog, Map<String, RouteDefinition> routes,
                                List<HookDeclaration> hooks) {
        return new PipelineLoader(root, getClass().getClassLoader()).load(settings, catalog, routes, hooks);
    }

    private static ReadyPipeline await(BootstrapSequencer sequencer) throws Exception {
        return sequencer.start().get(10, TimeUnit.SECONDS);
    }

    @Test
    void singleRouteReachesReadyWithResolvedPermalinks() throws Exception {
        LoadedPipeline loaded = load(FolioSettings.builder().build(), new PluginCatalog(),
                Map.of("pages", Fixtures.route("pages", List.of(Request.of("a"), Request.of("b")))), List.of());
        BootstrapSequencer sequencer = new BootstrapSequencer(loaded);

        ReadyPipeline ready = await(sequencer);

        assertEquals(BootstrapState.READY, sequencer.getState());
        assertEquals(List.of("/a", "/b"), ready.getRequests().stream().map(Request::getPermalink).toList());
        assertTrue(ready.getServerLookup().isEmpty());
    }

    @Test
    void duplicatePermalinkAcrossRoutesFailsReadiness() {
        Map<String, RouteDefinition> routes = new LinkedHashMap<>();
        routes.put("blog", Fixtures.route("blog", List.of(Request.of("x"))));
        routes.put("pages", Fixtures.route("pages", List.of(Request.of("x"))));
        BootstrapSequencer sequencer = new BootstrapSequencer(load(FolioSettings.builder().build(), new PluginCatalog(),
                routes, List.of()));

        CompletionException e = assertThrows(CompletionException.class, () -> sequencer.start().join());

        DuplicatePermalinkException duplicate = assertInstanceOf(DuplicatePermalinkException.class, e.getCause());
        assertEquals("blog", duplicate.getFirst().getRoute());
        assertEquals("pages", duplicate.getSecond().getRoute());
        assertEquals(BootstrapState.FAILED, sequencer.getState());
    }

    @Test
    void unknownPluginFailsDuringLoading() {
        FolioSettings settings = FolioSettings.builder().plugin("folio-plugin-nowhere", Map.of()).build();

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> load(settings, null, Map.of(), List.of()));

        assertEquals("folio-plugin-nowhere", e.getPluginName());
    }

    @Test
    void hookForUnknownPointIsDroppedAndBootstrapCompletes() throws Exception {
        HookDeclaration unknown = Fixtures.hook("beforeEverything", "early", ctx -> HookPatch.none());
        HookDeclaration known = Fixtures.hook(HookInterface.BOOTSTRAP, "seed",
                ctx -> HookPatch.data(Map.of("seeded", true))).toBuilder().mutates(HookSlot.DATA).build();
        LoadedPipeline loaded = load(FolioSettings.builder().build(), new PluginCatalog(),
                Map.of("pages", Fixtures.route("pages", List.of(Request.of("a")))), List.of(unknown, known));

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        assertFalse(ready.getContext().getHooks().stream().anyMatch(h -> h.getName().equals("early")));
        assertEquals(true, ready.getContext().getData().get("seeded"));
    }

    @Test
    void allRequestsHookCanAddRequestsBeforeResolution() throws Exception {
        HookDeclaration addHome = Fixtures.hook(HookInterface.ALL_REQUESTS_HOOK, "addHome", ctx -> {
            List<Request> next = new ArrayList<>(ctx.getAllRequests());
            next.add(Request.of("home").withRoute("pages"));
            return HookPatch.allRequests(next);
        });
        LoadedPipeline loaded = load(FolioSettings.builder().context(BuildContext.SERVER).build(), new PluginCatalog(),
                Map.of("pages", Fixtures.route("pages", List.of(Request.of("a")))), List.of(addHome));

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        assertEquals(2, ready.getRequests().size());
        assertTrue(ready.getServerLookup().containsKey("/home"));
    }

    @Test
    void customizeHooksSkipsPluginHooksAndCanExtendInterface() throws Exception {
        List<String> customizeRuns = new ArrayList<>();
        HookPoint audit = new HookPoint("audit", "project audit", EnumSet.of(HookSlot.ERRORS), EnumSet.of(HookSlot.ERRORS), true);
        HookDeclaration extend = Fixtures.hook(HookInterface.CUSTOMIZE_HOOKS, "addAudit", ctx -> {
            customizeRuns.add("project");
            return HookPatch.hookInterface(ctx.getHookInterface().with(audit));
        });
        PluginProvider plugin = new PluginProvider() {
            @Override
            public String getName() {
                return "sneaky";
            }

            @Override
            public PluginDefinition createDefinition() {
                return PluginDefinition.builder()
                        .name("sneaky")
                        .hooks(List.of(PluginHookDeclaration.builder()
                                .hook(HookInterface.CUSTOMIZE_HOOKS).name("pluginCustomize").description("x")
                                .run((p, ctx) -> {
                                    customizeRuns.add("plugin");
                                    return PluginHookResult.unchanged();
                                })
                                .build()))
                        .build();
            }
        };
        LoadedPipeline loaded = load(FolioSettings.builder().plugin("sneaky", Map.of()).build(), PluginCatalog.of(plugin),
                Map.of(), List.of(extend));

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        assertEquals(List.of("project"), customizeRuns);
        assertTrue(ready.getRunner().getHookInterface().contains("audit"));
        assertTrue(ready.getRunner().getHookInterface().get("audit").isExperimental());
    }

    @Test
    void invalidPluginHookIsDroppedWithoutFailingThePlugin() throws Exception {
        PluginProvider plugin = new PluginProvider() {
            @Override
            public String getName() {
                return "sloppy";
            }

            @Override
            public PluginDefinition createDefinition() {
                return PluginDefinition.builder()
                        .name("sloppy")
                        .hooks(List.of(
                                PluginHookDeclaration.builder()
                                        .hook(HookInterface.BOOTSTRAP).name("tooLow").description("x").priority(0)
                                        .run((p, ctx) -> PluginHookResult.unchanged())
                                        .build(),
                                PluginHookDeclaration.builder()
                                        .hook(HookInterface.BOOTSTRAP).name("fine").description("x")
                                        .mutates(HookSlot.DATA)
                                        .run((p, ctx) -> PluginHookResult.of(HookPatch.data(Map.of("sloppy", "ran"))))
                                        .build()))
                        .build();
            }
        };
        LoadedPipeline loaded = load(FolioSettings.builder().plugin("sloppy", Map.of()).build(), PluginCatalog.of(plugin),
                Map.of("pages", Fixtures.route("pages", List.of(Request.of("a")))), List.of());

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        List<String> names = ready.getContext().getHooks().stream().map(HookDeclaration::getName).toList();
        assertFalse(names.contains("tooLow"));
        assertTrue(names.contains("fine"));
        assertEquals("ran", ready.getContext().getData().get("sloppy"));
    }

    @Test
    void pluginHooksSeeStateFromPreviousInvocation() throws Exception {
        List<Object> seen = new ArrayList<>();
        PluginHookDeclaration.Builder counting = PluginHookDeclaration.builder()
                .description("counts")
                .run((p, ctx) -> {
                    int count = (Integer) p.getProps().getOrDefault("count", 0);
                    seen.add(count);
                    return PluginHookResult.of(HookPatch.none(), p.withProp("count", count + 1));
                });
        PluginProvider plugin = new PluginProvider() {
            @Override
            public String getName() {
                return "counter";
            }

            @Override
            public PluginDefinition createDefinition() {
                return PluginDefinition.builder()
                        .name("counter")
                        .hooks(List.of(
                                counting.hook(HookInterface.BOOTSTRAP).name("countBootstrap").build(),
                                counting.hook(HookInterface.ALL_REQUESTS_HOOK).name("countRequests").build()))
                        .build();
            }
        };
        LoadedPipeline loaded = load(FolioSettings.builder().plugin("counter", Map.of()).build(), PluginCatalog.of(plugin),
                Map.of(), List.of());

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        assertEquals(List.of(0, 1), seen);
        assertEquals(2, ready.getPlugins().getStore().get("counter").getProp("count"));
    }

    @Test
    void projectHooksAreDiscoveredWhenNoneArePassed() throws Exception {
        LoadedPipeline loaded = load(FolioSettings.builder().build(), new PluginCatalog(), Map.of(), null);

        ReadyPipeline ready = await(new BootstrapSequencer(loaded));

        assertEquals("folio", ready.getContext().getData().get("site"));
    }

    @Test
    void startTwiceReturnsSameFuture() {
        BootstrapSequencer sequencer = new BootstrapSequencer(load(FolioSettings.builder().build(), new PluginCatalog(),
                Map.of(), List.of()));

        assertTrue(sequencer.start() == sequencer.start());
    }
}
