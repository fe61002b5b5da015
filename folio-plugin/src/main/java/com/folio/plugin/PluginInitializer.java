package com.folio.plugin;

import com.folio.config.SettingsView;

/**
 * A plugin's {@code init}. Receives the definition with its merged configuration and a read-only
 * settings view; returns the definition to use from then on, or {@code null} to keep the given one.
 */
@FunctionalInterface
public interface PluginInitializer {

    PluginDefinition init(PluginDefinition plugin, SettingsView settings) throws Exception;
}
