package com.folio.plugin;

/**
 * Where a plugin was found, in lookup order.
 */
public enum PluginSource {
    /** {@code <srcFolder>/plugins/<name>/} */
    SRC,
    /** {@code <buildFolder>/plugins/<name>/} */
    BUILD,
    /** {@code <packagesFolder>/<name>/} */
    PACKAGES,
    /** Installed on the application classpath. */
    CLASSPATH,
    /** Registered directly through {@link PluginCatalog#register}. */
    EXPLICIT
}
