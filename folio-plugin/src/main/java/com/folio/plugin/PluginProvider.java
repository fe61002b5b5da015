package com.folio.plugin;

/**
 * SPI for plugins. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.folio.plugin.PluginProvider), either on the application classpath or inside
 * the jars of a plugin directory. The provider name is what {@code settings.plugins} refers to.
 */
public interface PluginProvider {

    /**
     * Plugin name (e.g. "folio-plugin-markdown"). Must match the key in the plugin configuration.
     */
    String getName();

    /**
     * Fresh, uninitialized definition. Called once per pipeline.
     */
    PluginDefinition createDefinition();

    /**
     * Plugin version for logs. Defaults to "1.0".
     */
    default String getVersion() {
        return "1.0";
    }
}
