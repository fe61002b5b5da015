package com.folio.plugin;

import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.Provenance;
import com.folio.routes.Request;
import com.folio.routes.RouteDataFunction;
import com.folio.routes.RouteDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginLoaderTest {

    @TempDir
    Path root;

    private static PluginProvider provider(String name, PluginDefinition definition) {
        return new PluginProvider() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public PluginDefinition createDefinition() {
                return definition;
            }
        };
    }

    private static RouteDefinition route(String template) {
        return RouteDefinition.builder()
                .all(List.of(Request.of("a")))
                .permalink((r, s) -> "/" + r.getSlug() + "/")
                .template(template)
                .build();
    }

    @Test
    void load_mergesUserConfigOverPluginDefaults() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        PluginDefinition definition = PluginDefinition.builder()
                .name("feed")
                .config(Map.of("path", "/rss.xml", "limit", 10))
                .initializer((plugin, settings) -> {
                    seen.set(plugin.getConfig());
                    return null;
                })
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("feed", Map.of("limit", 20)).build();

        LoadedPlugins loaded = new PluginLoader(root).load(settings, PluginCatalog.of(provider("feed", definition)));

        assertEquals(Map.of("path", "/rss.xml", "limit", 20), seen.get());
        assertEquals(20, loaded.getPlugins().get(0).getConfig().get("limit"));
        assertEquals(20, loaded.getStore().get("feed").getConfig().get("limit"));
    }

    @Test
    void load_initCannotMutateSettings() {
        PluginDefinition definition = PluginDefinition.builder()
                .name("rogue")
                .initializer((plugin, settings) -> {
                    settings.asMap().put("context", "server");
                    return plugin;
                })
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("rogue", Map.of()).build();
        PluginLoader loader = new PluginLoader(root);
        PluginCatalog catalog = PluginCatalog.of(provider("rogue", definition));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> loader.load(settings, catalog));

        assertTrue(e.getMessage().contains("plugin init()"));
    }

    @Test
    void load_invalidPluginIsFatal() {
        PluginDefinition definition = PluginDefinition.builder()
                .name("broken")
                .hooks(Arrays.asList(PluginHookDeclaration.builder().hook(HookInterface.BOOTSTRAP).build(), null))
                .initializer((plugin, settings) -> plugin.toBuilder().name(" ").build())
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("broken", Map.of()).build();
        PluginLoader loader = new PluginLoader(root);
        PluginCatalog catalog = PluginCatalog.of(provider("broken", definition));

        PluginValidationException e = assertThrows(PluginValidationException.class, () -> loader.load(settings, catalog));

        assertEquals("broken", e.getPluginName());
        assertEquals(List.of("'name' is required", "hooks[1] is null"), e.getProblems());
    }

    @Test
    void load_keepsPluginWithBadHookForLaterHookValidation() {
        PluginDefinition definition = PluginDefinition.builder()
                .name("sloppy")
                .hooks(List.of(PluginHookDeclaration.builder()
                        .hook(HookInterface.BOOTSTRAP).name("tooLow").description("x").priority(0)
                        .run((p, ctx) -> PluginHookResult.unchanged())
                        .build()))
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("sloppy", Map.of()).build();

        LoadedPlugins loaded = new PluginLoader(root).load(settings, PluginCatalog.of(provider("sloppy", definition)));

        assertEquals(1, loaded.getHooks().size());
        assertEquals(0, loaded.getHooks().get(0).getPriority());
    }

    @Test
    void load_missingFromCatalogIsFatal() {
        FolioSettings settings = FolioSettings.builder().plugin("ghost", Map.of()).build();
        PluginLoader loader = new PluginLoader(root);

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> loader.load(settings, new PluginCatalog()));

        assertEquals("ghost", e.getPluginName());
    }

    @Test
    void load_preparesPluginRoutes() throws Exception {
        HookDeclaration routeHook = HookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP).name("routeHook").description("x")
                .run(ctx -> HookPatch.none())
                .build();
        Files.createDirectories(root.resolve("___folio___/compiled"));
        Files.writeString(root.resolve("___folio___/compiled/Present.js"), "");
        PluginDefinition definition = PluginDefinition.builder()
                .name("docs")
                .routes(Map.of(
                        "withHooks", route("Plain.html").withHooks(List.of(routeHook)),
                        "present", route("Present.svelte"),
                        "missing", route("Missing.svelte")))
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("docs", Map.of()).build();

        LoadedPlugins loaded = new PluginLoader(root).load(settings, PluginCatalog.of(provider("docs", definition)));

        RouteDefinition withHooks = loaded.getRoutes().get("withHooks");
        assertTrue(withHooks.getHooks().isEmpty());
        assertEquals("withHooks", withHooks.getName());
        assertSame(RouteDataFunction.EMPTY, withHooks.getData());
        assertEquals(Provenance.plugin("docs"), withHooks.getProvenance());

        RouteDefinition present = loaded.getRoutes().get("present");
        assertEquals("Present", present.getTemplateComponent().name());
        assertEquals(root.resolve("___folio___/compiled/Present.js"), present.getTemplateComponent().artifact());

        // a missing artifact only warns
        assertNotNull(loaded.getRoutes().get("missing").getTemplateComponent());
    }

    @Test
    void load_adaptsPluginHooksWithPluginProvenance() {
        PluginDefinition definition = PluginDefinition.builder()
                .name("seo")
                .hooks(List.of(PluginHookDeclaration.builder()
                        .hook(HookInterface.BOOTSTRAP).name("seoCheck").description("checks")
                        .run((plugin, ctx) -> PluginHookResult.unchanged())
                        .build()))
                .build();
        FolioSettings settings = FolioSettings.builder().plugin("seo", Map.of()).build();

        LoadedPlugins loaded = new PluginLoader(root).load(settings, PluginCatalog.of(provider("seo", definition)));

        assertEquals(1, loaded.getHooks().size());
        assertEquals(Provenance.plugin("seo"), loaded.getHooks().get(0).getProvenance());
    }
}
