package com.folio.bootstrap;

import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.plugin.LoadedPlugins;

import java.util.List;
import java.util.Objects;

/**
 * Everything resolved synchronously before the staged bootstrap starts: settings, initialized plugins,
 * merged routes and the validated, enabled hook list in aggregation order.
 */
public final class LoadedPipeline {

    private final FolioSettings settings;
    private final HookInterface hookInterface;
    private final LoadedPlugins plugins;
    private final RouteCollection routes;
    private final List<HookDeclaration> hooks;

    public LoadedPipeline(FolioSettings settings, HookInterface hookInterface, LoadedPlugins plugins,
                          RouteCollection routes, List<HookDeclaration> hooks) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hookInterface = Objects.requireNonNull(hookInterface, "hookInterface");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.routes = Objects.requireNonNull(routes, "routes");
        this.hooks = List.copyOf(hooks);
    }

    public FolioSettings getSettings() {
        return settings;
    }

    public HookInterface getHookInterface() {
        return hookInterface;
    }

    public LoadedPlugins getPlugins() {
        return plugins;
    }

    public RouteCollection getRoutes() {
        return routes;
    }

    public List<HookDeclaration> getHooks() {
        return hooks;
    }
}
