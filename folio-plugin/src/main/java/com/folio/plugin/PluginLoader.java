package com.folio.plugin;

import com.folio.config.ConfigMerge;
import com.folio.config.FolioSettings;
import com.folio.config.SettingsView;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.Provenance;
import com.folio.routes.RouteDataFunction;
import com.folio.routes.RouteDefinition;
import com.folio.routes.TemplateComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Initializes the configured plugins, in configuration order, from a resolved {@link PluginCatalog}.
 * <p>
 * Per plugin: configuration is the user's configuration deep-merged over the plugin defaults (user
 * wins), {@code init} gets a read-only settings view, the result is validated (failure is fatal),
 * hooks are adapted to carry plugin state, and routes are prepared: route-level hooks are dropped with a
 * warning, a missing {@code data} becomes the empty function, and templated files are resolved to their
 * compiled artifact (a missing artifact only warns).
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private final Path projectRoot;
    private final PluginValidator validator = new PluginValidator();

    public PluginLoader(Path projectRoot) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
    }

    /**
     * @throws PluginNotFoundException   if a configured plugin is not in the catalog
     * @throws PluginValidationException if a plugin fails to initialize or is malformed
     */
    public LoadedPlugins load(FolioSettings settings, PluginCatalog catalog) {
        PluginStateStore store = new PluginStateStore();
        PluginHookAdapter adapter = new PluginHookAdapter(store);
        SettingsView initView = SettingsView.of(settings, "plugin init()");
        SettingsView hookView = SettingsView.of(settings, "plugin hooks");

        List<PluginInstance> plugins = new ArrayList<>();
        List<HookDeclaration> hooks = new ArrayList<>();
        Map<String, RouteDefinition> routes = new LinkedHashMap<>();

        for (Map.Entry<String, Map<String, Object>> configured : settings.getPlugins().entrySet()) {
            String name = configured.getKey();
            PluginCatalog.Entry entry = catalog.get(name);
            if (entry == null) {
                throw new PluginNotFoundException(name, List.of("plugin catalog " + catalog.names()));
            }
            PluginDefinition definition = initialize(name, entry.provider(), configured.getValue(), initView);

            PluginInstance instance = PluginInstance.from(definition, hookView);
            store.put(instance);
            plugins.add(instance);

            for (PluginHookDeclaration hook : definition.getHooks()) {
                hooks.add(adapter.adapt(name, hook));
            }
            for (Map.Entry<String, RouteDefinition> route : definition.getRoutes().entrySet()) {
                routes.put(route.getKey(), prepareRoute(name, route.getKey(), route.getValue(), settings));
            }
            log.debug("Loaded plugin {}: {} hook(s), {} route(s)", name, definition.getHooks().size(),
                    definition.getRoutes().size());
        }
        log.info("Loaded {} plugin(s) contributing {} hook(s) and {} route(s)", plugins.size(), hooks.size(), routes.size());
        return new LoadedPlugins(plugins, hooks, routes, store);
    }

    private PluginDefinition initialize(String name, PluginProvider provider, Map<String, Object> userConfig,
                                        SettingsView settings) {
        PluginDefinition created;
        try {
            created = provider.createDefinition();
        } catch (RuntimeException e) {
            throw new PluginValidationException(name, "provider failed to create a definition: " + e.getMessage(), e);
        }
        if (created == null) {
            throw new PluginValidationException(name, List.of("provider returned no definition"));
        }
        PluginDefinition merged = created.withConfig(ConfigMerge.defaultsDeep(userConfig, created.getConfig()));
        PluginDefinition initialized = merged;
        if (merged.getInitializer() != null) {
            try {
                PluginDefinition returned = merged.getInitializer().init(merged, settings);
                if (returned != null) initialized = returned;
            } catch (UnsupportedOperationException e) {
                throw e;
            } catch (Exception e) {
                throw new PluginValidationException(name, "init() failed: " + e.getMessage(), e);
            }
        }
        validator.validate(initialized, name);
        if (!name.equals(initialized.getName())) {
            log.warn("Plugin configured as '{}' calls itself '{}'; using '{}'", name, initialized.getName(), name);
            initialized = initialized.toBuilder().name(name).build();
        }
        return initialized;
    }

    private RouteDefinition prepareRoute(String pluginName, String routeName, RouteDefinition route,
                                         FolioSettings settings) {
        RouteDefinition prepared = route.withProvenance(Provenance.plugin(pluginName));
        if (prepared.getName() == null) {
            prepared = prepared.withName(routeName);
        }
        if (!prepared.getHooks().isEmpty()) {
            log.warn("Plugin {} route {} declares {} hook(s). Plugin routes cannot carry hooks; "
                            + "declare them on the plugin instead. Dropping them.",
                    pluginName, routeName, prepared.getHooks().size());
            prepared = prepared.withHooks(List.of());
        }
        if (prepared.getData() == null) {
            prepared = prepared.withData(RouteDataFunction.EMPTY);
        }
        String template = prepared.getTemplate();
        String extension = settings.getTemplateExtension();
        if (template != null && extension != null && template.endsWith(extension)
                && prepared.getTemplateComponent() == null) {
            String componentName = template.substring(0, template.length() - extension.length());
            Path artifact = projectRoot.resolve(settings.getSsrComponents())
                    .resolve(componentName + settings.getCompiledTemplateExtension());
            if (!Files.exists(artifact)) {
                log.warn("Plugin {} route {} uses template {} but its compiled component was not found at {}. "
                        + "Rendering will fail until it is compiled.", pluginName, routeName, template, artifact);
            }
            prepared = prepared.withTemplateComponent(new TemplateComponent(componentName, artifact));
        }
        return prepared;
    }
}
