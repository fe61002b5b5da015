package com.folio.bootstrap;

import com.folio.config.SettingsView;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookRunner;
import com.folio.hooks.HookValidator;
import com.folio.hooks.PipelineContext;
import com.folio.hooks.SourceType;
import com.folio.routes.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Drives a loaded pipeline to {@link BootstrapState#READY}:
 * <ol>
 *   <li>{@code customizeHooks} over every hook except plugin hooks; the runner is then rebuilt over all
 *       hooks with the resulting hook interface</li>
 *   <li>{@code bootstrap}</li>
 *   <li>request enumeration</li>
 *   <li>{@code allRequests}</li>
 *   <li>permalink resolution and duplicate detection</li>
 * </ol>
 * Runs once, on its own thread. The returned future completes with the ready pipeline, or exceptionally
 * with the first fatal error; nothing partial is exposed.
 */
public final class BootstrapSequencer {

    private static final Logger log = LoggerFactory.getLogger(BootstrapSequencer.class);

    private final LoadedPipeline loaded;
    private final AtomicReference<BootstrapState> state = new AtomicReference<>(BootstrapState.LOADING);
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<ReadyPipeline> ready = new CompletableFuture<>();

    public BootstrapSequencer(LoadedPipeline loaded) {
        this.loaded = Objects.requireNonNull(loaded, "loaded");
    }

    public BootstrapState getState() {
        return state.get();
    }

    /**
     * Starts the sequence on a dedicated thread. Later calls return the same future.
     */
    public CompletableFuture<ReadyPipeline> start() {
        if (!started.compareAndSet(false, true)) {
            return ready;
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "folio-bootstrap");
            t.setDaemon(true);
            return t;
        });
        executor.execute(() -> {
            try {
                ready.complete(runSequence());
            } catch (Throwable t) {
                state.set(BootstrapState.FAILED);
                log.error("Bootstrap failed: {}", t.getMessage(), t);
                ready.completeExceptionally(t);
            }
        });
        executor.shutdown();
        return ready;
    }

    /** Future completed when the pipeline is ready. */
    public CompletableFuture<ReadyPipeline> readiness() {
        return ready;
    }

    private ReadyPipeline runSequence() {
        boolean debugHooks = loaded.getSettings().isDebugHooks();
        SettingsView settings = SettingsView.of(loaded.getSettings(), "hooks");
        List<HookDeclaration> allHooks = loaded.getHooks();

        PipelineContext context = PipelineContext.builder()
                .settings(settings)
                .routes(loaded.getRoutes().routes())
                .hooks(allHooks)
                .hookInterface(loaded.getHookInterface())
                .build();

        advance(BootstrapState.CUSTOMIZE_HOOKS);
        List<HookDeclaration> nonPlugin = allHooks.stream()
                .filter(h -> h.getProvenance() == null || h.getProvenance().type() != SourceType.PLUGIN)
                .collect(Collectors.toList());
        context = new HookRunner(nonPlugin, loaded.getHookInterface(), debugHooks)
                .run(HookInterface.CUSTOMIZE_HOOKS, context);

        HookInterface hookInterface = context.getHookInterface();
        List<HookDeclaration> hooks = allHooks;
        if (hookInterface != loaded.getHookInterface()) {
            hooks = new HookValidator(hookInterface).validateAll(allHooks);
            log.info("Hook interface customized: {} hook point(s), {} hook(s) still valid",
                    hookInterface.getPoints().size(), hooks.size());
            context = context.toBuilder().hooks(hooks).build();
        }
        HookRunner runner = new HookRunner(hooks, hookInterface, debugHooks);

        advance(BootstrapState.BOOTSTRAP);
        context = runIfPresent(runner, HookInterface.BOOTSTRAP, context);

        advance(BootstrapState.ENUMERATE_REQUESTS);
        List<Request> requests = new RequestEnumerator().enumerate(context);
        context = context.withAllRequests(requests);

        advance(BootstrapState.ALL_REQUESTS);
        context = runIfPresent(runner, HookInterface.ALL_REQUESTS_HOOK, context);

        advance(BootstrapState.RESOLVE_PERMALINKS);
        ResolvedRequests resolved = new PermalinkResolver()
                .resolve(context.getAllRequests(), context.getRoutes(), settings);
        context = context.withAllRequests(resolved.requests());

        ReadyPipeline pipeline = new ReadyPipeline(loaded.getSettings(), context, resolved.serverLookup(), runner,
                loaded.getPlugins());
        advance(BootstrapState.READY);
        log.info("Pipeline ready: {} request(s), {} hook error(s)", resolved.requests().size(), context.getErrors().size());
        return pipeline;
    }

    private static PipelineContext runIfPresent(HookRunner runner, String hookName, PipelineContext context) {
        // a customized interface may have removed the point
        if (!runner.getHookInterface().contains(hookName)) {
            log.warn("Hook point '{}' was removed by customizeHooks; skipping it", hookName);
            return context;
        }
        return runner.run(hookName, context);
    }

    private void advance(BootstrapState next) {
        BootstrapState previous = state.getAndSet(next);
        if (next.ordinal() <= previous.ordinal()) {
            throw new IllegalStateException("Pipeline cannot move from " + previous + " to " + next);
        }
        log.info("Bootstrap: {} -> {}", previous, next);
    }
}
