package com.folio.plugin;

import com.folio.routes.RouteDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A plugin as produced by its {@link PluginProvider}: default configuration, hooks, routes, free-form
 * properties and an optional initializer. Immutable; not validated on construction
 * (see {@link PluginValidator}).
 */
public final class PluginDefinition {

    private final String name;
    private final Map<String, Object> config;
    private final List<PluginHookDeclaration> hooks;
    private final Map<String, RouteDefinition> routes;
    private final Map<String, Object> props;
    private final PluginInitializer initializer;

    private PluginDefinition(Builder b) {
        this.name = b.name;
        this.config = copy(b.config);
        this.hooks = b.hooks != null ? Collections.unmodifiableList(new ArrayList<>(b.hooks)) : List.of();
        this.routes = b.routes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.routes)) : Map.of();
        this.props = copy(b.props);
        this.initializer = b.initializer;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public String getName() {
        return name;
    }

    /** Default configuration, or after loading the merged one. */
    public Map<String, Object> getConfig() {
        return config;
    }

    public List<PluginHookDeclaration> getHooks() {
        return hooks;
    }

    public Map<String, RouteDefinition> getRoutes() {
        return routes;
    }

    /** Plugin-declared properties carried into the plugin instance. */
    public Map<String, Object> getProps() {
        return props;
    }

    /** Null when the plugin has no init step. */
    public PluginInitializer getInitializer() {
        return initializer;
    }

    public PluginDefinition withConfig(Map<String, Object> config) {
        return toBuilder().config(config).build();
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .config(config)
                .hooks(hooks)
                .routes(routes)
                .props(props)
                .initializer(initializer);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PluginDefinition{name=" + name + ", hooks=" + hooks.size() + ", routes=" + routes.keySet() + "}";
    }

    public static final class Builder {
        private String name;
        private Map<String, Object> config;
        private List<PluginHookDeclaration> hooks;
        private Map<String, RouteDefinition> routes;
        private Map<String, Object> props;
        private PluginInitializer initializer;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder hooks(List<PluginHookDeclaration> hooks) {
            this.hooks = hooks;
            return this;
        }

        public Builder routes(Map<String, RouteDefinition> routes) {
            this.routes = routes;
            return this;
        }

        public Builder props(Map<String, Object> props) {
            this.props = props;
            return this;
        }

        public Builder initializer(PluginInitializer initializer) {
            this.initializer = initializer;
            return this;
        }

        public PluginDefinition build() {
            return new PluginDefinition(this);
        }
    }
}
