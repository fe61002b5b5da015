package com.folio.plugin;

import com.folio.config.FolioSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Builds a {@link PluginCatalog} for the configured plugin names. Each name is looked up in order:
 * <ol>
 *   <li>{@code <root>/<srcFolder>/plugins/<name>/*.jar}</li>
 *   <li>{@code <root>/<buildFolder>/plugins/<name>/*.jar} (skipped when no build folder is set)</li>
 *   <li>{@code <root>/<packagesFolder>/<name>/*.jar}</li>
 *   <li>providers installed on the application classpath</li>
 * </ol>
 * The first location holding a provider with that name wins. Jars of one directory share a
 * {@link URLClassLoader} whose parent is the application class loader, so plugins see the folio API.
 */
public final class TieredPluginCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(TieredPluginCatalogLoader.class);

    private final Path projectRoot;
    private final ClassLoader parent;
    // only loaders that supplied a plugin; plugin classes must stay loadable
    private final List<URLClassLoader> directoryLoaders = new ArrayList<>();
    private Map<String, PluginProvider> installed;

    public TieredPluginCatalogLoader(Path projectRoot) {
        this(projectRoot, TieredPluginCatalogLoader.class.getClassLoader());
    }

    public TieredPluginCatalogLoader(Path projectRoot, ClassLoader parent) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    /**
     * @throws PluginNotFoundException for the first configured plugin found nowhere
     */
    public PluginCatalog load(FolioSettings settings) {
        PluginCatalog catalog = new PluginCatalog();
        for (String name : settings.getPlugins().keySet()) {
            List<String> searched = new ArrayList<>();

            Path srcDir = projectRoot.resolve(settings.getSrcFolder()).resolve("plugins").resolve(name);
            PluginProvider provider = fromDirectory(srcDir, name, searched);
            PluginSource source = PluginSource.SRC;

            if (provider == null && !settings.getBuildFolder().isBlank()) {
                Path buildDir = projectRoot.resolve(settings.getBuildFolder()).resolve("plugins").resolve(name);
                provider = fromDirectory(buildDir, name, searched);
                source = PluginSource.BUILD;
            }
            if (provider == null) {
                Path packageDir = projectRoot.resolve(settings.getPackagesFolder()).resolve(name);
                provider = fromDirectory(packageDir, name, searched);
                source = PluginSource.PACKAGES;
            }
            if (provider == null) {
                searched.add("classpath");
                provider = installedProviders().get(name);
                source = PluginSource.CLASSPATH;
            }
            if (provider == null) {
                throw new PluginNotFoundException(name, searched);
            }
            log.info("Plugin {} {} resolved from {}", name, provider.getVersion(), source);
            catalog.register(provider, source);
        }
        return catalog;
    }

    private PluginProvider fromDirectory(Path dir, String name, List<String> searched) {
        searched.add(dir.toString());
        if (!Files.isDirectory(dir)) {
            return null;
        }
        List<URL> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            log.warn("Skipping plugin directory {}: {}", dir, e.getMessage());
            return null;
        } catch (IOException e) {
            log.warn("Failed to list plugin directory {}: {}", dir, e.getMessage());
            return null;
        }
        if (jars.isEmpty()) {
            log.debug("Plugin directory {} has no jars", dir);
            return null;
        }
        URLClassLoader loader = new URLClassLoader(jars.toArray(new URL[0]), parent);
        PluginProvider match = null;
        for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, loader)) {
            if (provider.getClass().getClassLoader() != loader) {
                continue; // inherited from the classpath, handled by the last tier
            }
            if (name.equals(provider.getName())) {
                match = provider;
                break;
            }
            log.warn("Plugin directory {} provides '{}', not '{}'; ignoring it", dir, provider.getName(), name);
        }
        if (match != null) {
            directoryLoaders.add(loader);
            return match;
        }
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader for {}: {}", dir, e.getMessage());
        }
        return null;
    }

    /** Class loaders kept open because they supplied a plugin. */
    int retainedLoaderCount() {
        return directoryLoaders.size();
    }

    private Map<String, PluginProvider> installedProviders() {
        if (installed == null) {
            installed = new LinkedHashMap<>();
            for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, parent)) {
                PluginProvider previous = installed.putIfAbsent(provider.getName(), provider);
                if (previous != null) {
                    log.warn("Plugin '{}' is installed twice ({} and {}); using the first",
                            provider.getName(), previous.getClass().getName(), provider.getClass().getName());
                }
            }
        }
        return installed;
    }
}
