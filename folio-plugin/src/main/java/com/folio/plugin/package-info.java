/**
 * Plugin SPI and loading.
 * <ul>
 *   <li>{@link com.folio.plugin.PluginProvider} – SPI discovered with ServiceLoader</li>
 *   <li>{@link com.folio.plugin.PluginCatalog} – resolved providers by name</li>
 *   <li>{@link com.folio.plugin.TieredPluginCatalogLoader} – src, build, packages, classpath lookup</li>
 *   <li>{@link com.folio.plugin.PluginLoader} – config merge, init, validation, route preparation</li>
 *   <li>{@link com.folio.plugin.PluginStateStore} / {@link com.folio.plugin.PluginHookAdapter} – per-plugin state between hook calls</li>
 * </ul>
 */
package com.folio.plugin;
