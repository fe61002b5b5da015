package com.folio.plugin;

import com.folio.config.SettingsView;
import com.folio.routes.RouteDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Initialized plugin as seen by its own hooks and by downstream code: name, merged configuration,
 * settings view, properties and routes. Initializer and hooks are stripped. Immutable; a hook that
 * wants to keep state between invocations returns a changed copy in its {@link PluginHookResult}.
 */
public final class PluginInstance {

    private final String name;
    private final Map<String, Object> config;
    private final SettingsView settings;
    private final Map<String, Object> props;
    private final Map<String, RouteDefinition> routes;

    public PluginInstance(String name, Map<String, Object> config, SettingsView settings,
                          Map<String, Object> props, Map<String, RouteDefinition> routes) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = copy(config);
        this.settings = settings;
        this.props = copy(props);
        this.routes = copy(routes);
    }

    static PluginInstance from(PluginDefinition definition, SettingsView settings) {
        return new PluginInstance(definition.getName(), definition.getConfig(), settings,
                definition.getProps(), definition.getRoutes());
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public SettingsView getSettings() {
        return settings;
    }

    public Map<String, Object> getProps() {
        return props;
    }

    public Object getProp(String key) {
        return props.get(key);
    }

    public Map<String, RouteDefinition> getRoutes() {
        return routes;
    }

    public PluginInstance withConfig(Map<String, Object> config) {
        return new PluginInstance(name, config, settings, props, routes);
    }

    public PluginInstance withProps(Map<String, Object> props) {
        return new PluginInstance(name, config, settings, props, routes);
    }

    /** Copy with one property set. */
    public PluginInstance withProp(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(props);
        next.put(key, value);
        return new PluginInstance(name, config, settings, next, routes);
    }

    @Override
    public String toString() {
        return "PluginInstance{name=" + name + ", props=" + props.keySet() + "}";
    }
}
