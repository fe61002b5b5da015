package com.folio.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable settings for one pipeline instance.
 * <p>
 * Locations: FOLIO_SRC_DIR, FOLIO_BUILD_DIR, FOLIO_SSR_COMPONENTS_DIR, FOLIO_PACKAGES_DIR.
 * Plugins: FOLIO_PLUGINS (comma-separated names, configured with empty user config).
 * Hooks: FOLIO_DISABLED_HOOKS (comma-separated hook names). Server: FOLIO_SERVER_PREFIX.
 * Debug: FOLIO_DEBUG_AUTOMAGIC, FOLIO_DEBUG_HOOKS, FOLIO_DEBUG_BUILD, FOLIO_DEBUG_PERFORMANCE.
 * <p>
 * Loading settings from project files is left to the caller; use {@link #builder()} for that.
 * Extension code never sees this object directly, only a {@link SettingsView}.
 */
public final class FolioSettings {

    private static final String ENV_CONTEXT = "FOLIO_CONTEXT";
    private static final String ENV_SRC_DIR = "FOLIO_SRC_DIR";
    private static final String ENV_BUILD_DIR = "FOLIO_BUILD_DIR";
    private static final String ENV_SSR_COMPONENTS_DIR = "FOLIO_SSR_COMPONENTS_DIR";
    private static final String ENV_PACKAGES_DIR = "FOLIO_PACKAGES_DIR";
    private static final String ENV_SERVER_PREFIX = "FOLIO_SERVER_PREFIX";
    private static final String ENV_PLUGINS = "FOLIO_PLUGINS";
    private static final String ENV_DISABLED_HOOKS = "FOLIO_DISABLED_HOOKS";
    private static final String ENV_DEBUG_AUTOMAGIC = "FOLIO_DEBUG_AUTOMAGIC";
    private static final String ENV_DEBUG_HOOKS = "FOLIO_DEBUG_HOOKS";
    private static final String ENV_DEBUG_BUILD = "FOLIO_DEBUG_BUILD";
    private static final String ENV_DEBUG_PERFORMANCE = "FOLIO_DEBUG_PERFORMANCE";

    private static final String DEFAULT_SRC_DIR = "src";
    private static final String DEFAULT_BUILD_DIR = "";
    private static final String DEFAULT_SSR_COMPONENTS_DIR = "___folio___/compiled";
    private static final String DEFAULT_PACKAGES_DIR = "packages";
    private static final String DEFAULT_TEMPLATE_EXTENSION = ".svelte";
    private static final String DEFAULT_COMPILED_TEMPLATE_EXTENSION = ".js";

    private final BuildContext context;
    private final String srcFolder;
    private final String buildFolder;
    private final String ssrComponents;
    private final String packagesFolder;
    private final String serverPrefix;
    private final Map<String, Map<String, Object>> plugins;
    private final List<String> disabledHooks;
    private final boolean debugAutomagic;
    private final boolean debugHooks;
    private final boolean debugBuild;
    private final boolean debugPerformance;
    private final String templateExtension;
    private final String compiledTemplateExtension;
    private final Map<String, Object> extra;

    private FolioSettings(Builder b) {
        this.context = b.context != null ? b.context : BuildContext.UNKNOWN;
        this.srcFolder = b.srcFolder;
        this.buildFolder = b.buildFolder != null ? b.buildFolder : "";
        this.ssrComponents = b.ssrComponents;
        this.packagesFolder = b.packagesFolder;
        this.serverPrefix = b.serverPrefix != null ? b.serverPrefix : "";
        Map<String, Map<String, Object>> pluginCopy = new LinkedHashMap<>();
        b.plugins.forEach((name, cfg) -> pluginCopy.put(name, Collections.unmodifiableMap(ReadOnlyCollections.deepCopy(cfg))));
        this.plugins = Collections.unmodifiableMap(pluginCopy);
        this.disabledHooks = List.copyOf(b.disabledHooks);
        // automagic discovery only makes sense when serving
        this.debugAutomagic = b.debugAutomagic && this.context == BuildContext.SERVER;
        this.debugHooks = b.debugHooks;
        this.debugBuild = b.debugBuild;
        this.debugPerformance = b.debugPerformance;
        this.templateExtension = b.templateExtension;
        this.compiledTemplateExtension = b.compiledTemplateExtension;
        this.extra = Collections.unmodifiableMap(ReadOnlyCollections.deepCopy(b.extra));
    }

    public BuildContext getContext() {
        return context;
    }

    /** Project source folder (plugins are looked up under {@code <srcFolder>/plugins/<name>}). */
    public String getSrcFolder() {
        return srcFolder;
    }

    /** Build output folder; empty when the project has no separate build step. */
    public String getBuildFolder() {
        return buildFolder;
    }

    /** Folder holding compiled, renderable template artifacts. */
    public String getSsrComponents() {
        return ssrComponents;
    }

    /** Folder holding installed plugin packages ({@code <packagesFolder>/<name>}). */
    public String getPackagesFolder() {
        return packagesFolder;
    }

    /** Prefix prepended to every permalink in {@link BuildContext#SERVER} context; empty if none. */
    public String getServerPrefix() {
        return serverPrefix;
    }

    /** Configured plugins in declaration order: name → user config. Unmodifiable. */
    public Map<String, Map<String, Object>> getPlugins() {
        return plugins;
    }

    /** Hook names excluded from execution. */
    public List<String> getDisabledHooks() {
        return disabledHooks;
    }

    public boolean isDebugAutomagic() {
        return debugAutomagic;
    }

    public boolean isDebugHooks() {
        return debugHooks;
    }

    public boolean isDebugBuild() {
        return debugBuild;
    }

    public boolean isDebugPerformance() {
        return debugPerformance;
    }

    /** Template file extension that marks a route template as a compiled component reference (default .svelte). */
    public String getTemplateExtension() {
        return templateExtension;
    }

    /** Extension of compiled template artifacts under {@link #getSsrComponents()} (default .js). */
    public String getCompiledTemplateExtension() {
        return compiledTemplateExtension;
    }

    /** Free-form project settings. Unmodifiable. */
    public Map<String, Object> getExtra() {
        return extra;
    }

    /**
     * Plain tree of these settings (fresh, mutable copy). Used for read-only views and for
     * snapshots handed to workers.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> locations = new LinkedHashMap<>();
        locations.put("srcFolder", srcFolder);
        locations.put("buildFolder", buildFolder);
        locations.put("ssrComponents", ssrComponents);
        locations.put("packagesFolder", packagesFolder);

        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("automagic", debugAutomagic);
        debug.put("hooks", debugHooks);
        debug.put("build", debugBuild);
        debug.put("performance", debugPerformance);

        Map<String, Object> hooks = new LinkedHashMap<>();
        hooks.put("disable", new ArrayList<>(disabledHooks));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("context", context.wireName());
        out.put("locations", locations);
        out.put("server", serverPrefix.isEmpty() ? null : new LinkedHashMap<>(Map.of("prefix", serverPrefix)));
        out.put("plugins", ReadOnlyCollections.deepCopy(plugins));
        out.put("hooks", hooks);
        out.put("debug", debug);
        out.put("templateExtension", templateExtension);
        out.put("compiledTemplateExtension", compiledTemplateExtension);
        out.put("extra", ReadOnlyCollections.deepCopy(extra));
        return out;
    }

    public static FolioSettings fromEnvironment() {
        Builder b = builder()
                .context(BuildContext.fromName(System.getenv(ENV_CONTEXT)))
                .srcFolder(getEnv(ENV_SRC_DIR, DEFAULT_SRC_DIR))
                .buildFolder(getEnv(ENV_BUILD_DIR, DEFAULT_BUILD_DIR))
                .ssrComponents(getEnv(ENV_SSR_COMPONENTS_DIR, DEFAULT_SSR_COMPONENTS_DIR))
                .packagesFolder(getEnv(ENV_PACKAGES_DIR, DEFAULT_PACKAGES_DIR))
                .serverPrefix(getEnv(ENV_SERVER_PREFIX, ""))
                .disabledHooks(parseCommaSeparated(System.getenv(ENV_DISABLED_HOOKS)))
                .debugAutomagic(parseBoolean(System.getenv(ENV_DEBUG_AUTOMAGIC), false))
                .debugHooks(parseBoolean(System.getenv(ENV_DEBUG_HOOKS), false))
                .debugBuild(parseBoolean(System.getenv(ENV_DEBUG_BUILD), false))
                .debugPerformance(parseBoolean(System.getenv(ENV_DEBUG_PERFORMANCE), false));
        for (String plugin : parseCommaSeparated(System.getenv(ENV_PLUGINS))) {
            b.plugin(plugin, Map.of());
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        Builder b = builder()
                .context(context)
                .srcFolder(srcFolder)
                .buildFolder(buildFolder)
                .ssrComponents(ssrComponents)
                .packagesFolder(packagesFolder)
                .serverPrefix(serverPrefix)
                .disabledHooks(disabledHooks)
                .debugAutomagic(debugAutomagic)
                .debugHooks(debugHooks)
                .debugBuild(debugBuild)
                .debugPerformance(debugPerformance)
                .templateExtension(templateExtension)
                .compiledTemplateExtension(compiledTemplateExtension)
                .extra(extra);
        plugins.forEach(b::plugin);
        return b;
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private BuildContext context = BuildContext.UNKNOWN;
        private String srcFolder = DEFAULT_SRC_DIR;
        private String buildFolder = DEFAULT_BUILD_DIR;
        private String ssrComponents = DEFAULT_SSR_COMPONENTS_DIR;
        private String packagesFolder = DEFAULT_PACKAGES_DIR;
        private String serverPrefix = "";
        private final Map<String, Map<String, Object>> plugins = new LinkedHashMap<>();
        private List<String> disabledHooks = List.of();
        private boolean debugAutomagic;
        private boolean debugHooks;
        private boolean debugBuild;
        private boolean debugPerformance;
        private String templateExtension = DEFAULT_TEMPLATE_EXTENSION;
        private String compiledTemplateExtension = DEFAULT_COMPILED_TEMPLATE_EXTENSION;
        private Map<String, Object> extra = Map.of();

        public Builder context(BuildContext context) {
            this.context = context;
            return this;
        }

        public Builder srcFolder(String srcFolder) {
            this.srcFolder = srcFolder != null ? srcFolder : DEFAULT_SRC_DIR;
            return this;
        }

        public Builder buildFolder(String buildFolder) {
            this.buildFolder = buildFolder;
            return this;
        }

        public Builder ssrComponents(String ssrComponents) {
            this.ssrComponents = ssrComponents != null ? ssrComponents : DEFAULT_SSR_COMPONENTS_DIR;
            return this;
        }

        public Builder packagesFolder(String packagesFolder) {
            this.packagesFolder = packagesFolder != null ? packagesFolder : DEFAULT_PACKAGES_DIR;
            return this;
        }

        public Builder serverPrefix(String serverPrefix) {
            this.serverPrefix = serverPrefix;
            return this;
        }

        /** Adds (or replaces) a configured plugin; declaration order is kept. */
        public Builder plugin(String name, Map<String, ?> userConfig) {
            Objects.requireNonNull(name, "name");
            this.plugins.put(name.trim(), ReadOnlyCollections.deepCopy(userConfig));
            return this;
        }

        public Builder disabledHooks(List<String> disabledHooks) {
            this.disabledHooks = disabledHooks != null ? new ArrayList<>(disabledHooks) : List.of();
            return this;
        }

        public Builder debugAutomagic(boolean debugAutomagic) {
            this.debugAutomagic = debugAutomagic;
            return this;
        }

        public Builder debugHooks(boolean debugHooks) {
            this.debugHooks = debugHooks;
            return this;
        }

        public Builder debugBuild(boolean debugBuild) {
            this.debugBuild = debugBuild;
            return this;
        }

        public Builder debugPerformance(boolean debugPerformance) {
            this.debugPerformance = debugPerformance;
            return this;
        }

        public Builder templateExtension(String templateExtension) {
            this.templateExtension = templateExtension != null ? templateExtension : DEFAULT_TEMPLATE_EXTENSION;
            return this;
        }

        public Builder compiledTemplateExtension(String compiledTemplateExtension) {
            this.compiledTemplateExtension = compiledTemplateExtension != null
                    ? compiledTemplateExtension : DEFAULT_COMPILED_TEMPLATE_EXTENSION;
            return this;
        }

        public Builder extra(Map<String, ?> extra) {
            this.extra = extra != null ? ReadOnlyCollections.deepCopy(extra) : Map.of();
            return this;
        }

        public FolioSettings build() {
            return new FolioSettings(this);
        }
    }
}
