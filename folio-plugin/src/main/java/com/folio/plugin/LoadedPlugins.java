package com.folio.plugin;

import com.folio.hooks.HookDeclaration;
import com.folio.routes.RouteDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link PluginLoader#load}: initialized plugins in configuration order, their adapted hooks,
 * their prepared routes and the store holding each plugin's current instance.
 */
public final class LoadedPlugins {

    private final List<PluginInstance> plugins;
    private final List<HookDeclaration> hooks;
    private final Map<String, RouteDefinition> routes;
    private final PluginStateStore store;

    LoadedPlugins(List<PluginInstance> plugins, List<HookDeclaration> hooks,
                  Map<String, RouteDefinition> routes, PluginStateStore store) {
        this.plugins = List.copyOf(plugins);
        this.hooks = List.copyOf(hooks);
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        this.store = store;
    }

    public static LoadedPlugins empty() {
        return new LoadedPlugins(List.of(), List.of(), Map.of(), new PluginStateStore());
    }

    public List<PluginInstance> getPlugins() {
        return plugins;
    }

    public List<HookDeclaration> getHooks() {
        return hooks;
    }

    public Map<String, RouteDefinition> getRoutes() {
        return routes;
    }

    public PluginStateStore getStore() {
        return store;
    }
}
