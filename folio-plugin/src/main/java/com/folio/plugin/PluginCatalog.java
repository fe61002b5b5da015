package com.folio.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved plugins by name, built once before any pipeline state exists. The pipeline only reads from it;
 * how providers are found is the concern of {@link TieredPluginCatalogLoader} or of whoever registers
 * them directly (tests, embedding applications).
 */
public final class PluginCatalog {

    /** A provider and where it came from. */
    public record Entry(PluginProvider provider, PluginSource source) {
        public Entry {
            Objects.requireNonNull(provider, "provider");
            Objects.requireNonNull(source, "source");
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public static PluginCatalog of(PluginProvider... providers) {
        PluginCatalog catalog = new PluginCatalog();
        for (PluginProvider p : providers) {
            catalog.register(p);
        }
        return catalog;
    }

    /**
     * Registers a provider under its name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public PluginCatalog register(PluginProvider provider) {
        return register(provider, PluginSource.EXPLICIT);
    }

    public PluginCatalog register(PluginProvider provider, PluginSource source) {
        Objects.requireNonNull(provider, "provider");
        String name = provider.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name must be non-blank: " + provider.getClass().getName());
        }
        if (entries.putIfAbsent(name, new Entry(provider, source)) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + name);
        }
        return this;
    }

    /** Null when no such plugin. */
    public Entry get(String name) {
        return entries.get(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "PluginCatalog" + entries.keySet();
    }
}
