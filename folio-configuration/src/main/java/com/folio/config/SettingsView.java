package com.folio.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of {@link FolioSettings} handed to plugins, hooks, routes and permalink functions.
 * Typed getters delegate to the settings; {@link #asMap()} exposes the whole tree where every
 * mutation attempt throws {@link UnsupportedOperationException} naming the view and its usage.
 */
public final class SettingsView {

    private final FolioSettings settings;
    private final Map<String, Object> tree;

    private SettingsView(FolioSettings settings, String usage) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tree = ReadOnlyCollections.readOnlyMap(settings.toMap(), "Settings", usage);
    }

    /** View for general extension code. */
    public static SettingsView of(FolioSettings settings) {
        return new SettingsView(settings, null);
    }

    /** View whose mutation errors name where it was handed out (e.g. "plugin init()"). */
    public static SettingsView of(FolioSettings settings, String usage) {
        return new SettingsView(settings, usage);
    }

    public BuildContext getContext() {
        return settings.getContext();
    }

    public String getServerPrefix() {
        return settings.getServerPrefix();
    }

    public String getSrcFolder() {
        return settings.getSrcFolder();
    }

    public String getBuildFolder() {
        return settings.getBuildFolder();
    }

    public String getSsrComponents() {
        return settings.getSsrComponents();
    }

    public List<String> getDisabledHooks() {
        return settings.getDisabledHooks();
    }

    public boolean isDebugHooks() {
        return settings.isDebugHooks();
    }

    public boolean isDebugBuild() {
        return settings.isDebugBuild();
    }

    /** Top-level value of the settings tree (nested maps and lists are read-only too). */
    public Object get(String key) {
        return tree.get(key);
    }

    /** Whole settings tree, read-only. */
    public Map<String, Object> asMap() {
        return tree;
    }

    @Override
    public String toString() {
        return "SettingsView" + tree;
    }
}
