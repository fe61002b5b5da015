package com.folio.bootstrap;

import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.internal.hooks.InternalHooks;
import com.folio.plugin.LoadedPlugins;
import com.folio.plugin.PluginCatalog;
import com.folio.plugin.PluginLoader;
import com.folio.plugin.TieredPluginCatalogLoader;
import com.folio.routes.RouteDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The LOADING step: resolves plugins, initializes them, merges routes and collects hooks. Runs on the
 * caller's thread; any fatal error is thrown from {@link #load}.
 */
public final class PipelineLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineLoader.class);

    private final Path projectRoot;
    private final ClassLoader classLoader;

    public PipelineLoader(Path projectRoot, ClassLoader classLoader) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    /**
     * @param settings     pipeline settings
     * @param catalog      resolved plugins; null to look them up on disk and on the classpath
     * @param userRoutes   the project's routes by name
     * @param projectHooks the project's hooks; null to discover {@link ProjectHooks} providers
     */
    public LoadedPipeline load(FolioSettings settings, PluginCatalog catalog, Map<String, RouteDefinition> userRoutes,
                               List<HookDeclaration> projectHooks) {
        log.info("Loading pipeline (context={}, plugins={})", settings.getContext(), settings.getPlugins().keySet());
        PluginCatalog resolved = catalog != null
                ? catalog : new TieredPluginCatalogLoader(projectRoot, classLoader).load(settings);
        LoadedPlugins plugins = settings.getPlugins().isEmpty()
                ? LoadedPlugins.empty() : new PluginLoader(projectRoot).load(settings, resolved);

        RouteCollection routes = new RouteCollector()
                .collect(plugins.getRoutes(), userRoutes != null ? userRoutes : Map.of());

        List<HookDeclaration> fromProject = projectHooks != null
                ? ProjectHooksLoader.tag(projectHooks)
                : new ProjectHooksLoader(classLoader).discover(settings.isDebugAutomagic());

        HookInterface hookInterface = HookInterface.defaults();
        List<HookDeclaration> hooks = new HookCollector(hookInterface).collect(
                InternalHooks.all(), plugins.getHooks(), routes.routeHooks(), fromProject, settings.getDisabledHooks());

        log.info("Pipeline loaded: {} route(s), {} hook(s)", routes.routes().size(), hooks.size());
        return new LoadedPipeline(settings, hookInterface, plugins, routes, hooks);
    }
}
