package com.folio.bootstrap;

import com.folio.config.FolioSettings;
import com.folio.hooks.HookRunner;
import com.folio.hooks.PipelineContext;
import com.folio.plugin.LoadedPlugins;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bootstrapped pipeline: final context, permalink index for serving and the hook runner later stages
 * (rendering, serving, build) use.
 */
public final class ReadyPipeline {

    private final FolioSettings settings;
    private final PipelineContext context;
    private final Map<String, Request> serverLookup;
    private final HookRunner runner;
    private final LoadedPlugins plugins;

    public ReadyPipeline(FolioSettings settings, PipelineContext context, Map<String, Request> serverLookup,
                         HookRunner runner, LoadedPlugins plugins) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.context = Objects.requireNonNull(context, "context");
        this.serverLookup = Collections.unmodifiableMap(new LinkedHashMap<>(serverLookup));
        this.runner = Objects.requireNonNull(runner, "runner");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
    }

    public FolioSettings getSettings() {
        return settings;
    }

    public PipelineContext getContext() {
        return context;
    }

    /** Every request with its permalink, in enumeration order. */
    public List<Request> getRequests() {
        return context.getAllRequests();
    }

    public Map<String, RouteDefinition> getRoutes() {
        return context.getRoutes();
    }

    public RouteDefinition getRoute(String name) {
        return context.getRoutes().get(name);
    }

    /** Permalink to request; empty outside server context. */
    public Map<String, Request> getServerLookup() {
        return serverLookup;
    }

    public HookRunner getRunner() {
        return runner;
    }

    public LoadedPlugins getPlugins() {
        return plugins;
    }

    @Override
    public String toString() {
        return "ReadyPipeline{" + context + ", serverLookup=" + serverLookup.size() + "}";
    }
}
