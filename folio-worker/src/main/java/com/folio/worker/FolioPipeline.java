package com.folio.worker;

import com.folio.bootstrap.BootstrapSequencer;
import com.folio.bootstrap.BootstrapState;
import com.folio.bootstrap.LoadedPipeline;
import com.folio.bootstrap.PipelineLoader;
import com.folio.bootstrap.ReadyPipeline;
import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.plugin.PluginCatalog;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point. {@link Builder#create()} loads plugins, routes and hooks on the calling thread and starts
 * the bootstrap sequence in the background.
 * <ul>
 *   <li>{@link #cluster()}: readiness for a coordinator</li>
 *   <li>{@link #worker}: builds a batch of requests once ready</li>
 *   <li>{@link #build()}: the configured build orchestrator, if any</li>
 * </ul>
 */
public final class FolioPipeline {

    private final BootstrapSequencer sequencer;
    private final WorkerDispatcher dispatcher;
    private final MeterRegistry meterRegistry;
    private final BuildOrchestrator buildOrchestrator;

    private FolioPipeline(Builder b, LoadedPipeline loaded) {
        this.sequencer = new BootstrapSequencer(loaded);
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
        this.dispatcher = new WorkerDispatcher(meterRegistry);
        this.buildOrchestrator = b.buildOrchestrator;
        sequencer.start();
    }

    /** Completes when the pipeline is ready, or exceptionally with the bootstrap failure. */
    public CompletableFuture<ReadyPipeline> cluster() {
        return sequencer.readiness();
    }

    public BootstrapState getState() {
        return sequencer.getState();
    }

    /**
     * Waits for readiness, then builds the given requests in order.
     *
     * @throws com.folio.errors.BootstrapException if bootstrap failed
     */
    public List<RequestTimings> worker(List<Request> requests, PageRenderer renderer, ProgressChannel channel) {
        Objects.requireNonNull(renderer, "renderer");
        ReadyPipeline ready = awaitReady();
        return dispatcher.dispatch(ready, requests, renderer, channel != null ? channel : ProgressChannel.discarding());
    }

    /** Builds every request of the ready pipeline. */
    public List<RequestTimings> worker(PageRenderer renderer, ProgressChannel channel) {
        return worker(awaitReady().getRequests(), renderer, channel);
    }

    public Optional<BuildOrchestrator> build() {
        return Optional.ofNullable(buildOrchestrator);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private ReadyPipeline awaitReady() {
        try {
            return cluster().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public static Builder builder(FolioSettings settings) {
        return new Builder(settings);
    }

    public static final class Builder {
        private final FolioSettings settings;
        private Path projectRoot = Path.of("");
        private final Map<String, RouteDefinition> routes = new LinkedHashMap<>();
        private List<HookDeclaration> hooks;
        private PluginCatalog pluginCatalog;
        private ClassLoader classLoader = FolioPipeline.class.getClassLoader();
        private MeterRegistry meterRegistry;
        private BuildOrchestrator buildOrchestrator;

        private Builder(FolioSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
        }

        /** Directory the configured folders are relative to. Defaults to the working directory. */
        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
            return this;
        }

        public Builder route(String name, RouteDefinition route) {
            this.routes.put(name, route);
            return this;
        }

        public Builder routes(Map<String, RouteDefinition> routes) {
            this.routes.putAll(routes);
            return this;
        }

        /** Project hooks; when never called, {@link com.folio.bootstrap.ProjectHooks} providers are used. */
        public Builder hooks(List<HookDeclaration> hooks) {
            this.hooks = hooks;
            return this;
        }

        /** Pre-resolved plugins; when never called, plugins are looked up on disk and on the classpath. */
        public Builder pluginCatalog(PluginCatalog pluginCatalog) {
            this.pluginCatalog = pluginCatalog;
            return this;
        }

        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder buildOrchestrator(BuildOrchestrator buildOrchestrator) {
            this.buildOrchestrator = buildOrchestrator;
            return this;
        }

        /**
         * Loads the pipeline and starts bootstrap.
         *
         * @throws com.folio.plugin.PluginNotFoundException   if a configured plugin cannot be found
         * @throws com.folio.plugin.PluginValidationException if a plugin is malformed
         */
        public FolioPipeline create() {
            LoadedPipeline loaded = new PipelineLoader(projectRoot, classLoader)
                    .load(settings, pluginCatalog, routes, hooks);
            return new FolioPipeline(this, loaded);
        }
    }
}
