package com.folio.plugin;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current {@link PluginInstance} per plugin name. Hook invocation n sees what invocation n-1 stored.
 */
public final class PluginStateStore {

    private final Map<String, PluginInstance> instances = new ConcurrentHashMap<>();

    public void put(PluginInstance instance) {
        Objects.requireNonNull(instance, "instance");
        instances.put(instance.getName(), instance);
    }

    /**
     * @throws IllegalStateException if the plugin was never loaded
     */
    public PluginInstance get(String pluginName) {
        PluginInstance instance = instances.get(pluginName);
        if (instance == null) {
            throw new IllegalStateException("No state for plugin: " + pluginName);
        }
        return instance;
    }

    public boolean contains(String pluginName) {
        return instances.containsKey(pluginName);
    }

    public Map<String, PluginInstance> snapshot() {
        return Map.copyOf(instances);
    }
}
