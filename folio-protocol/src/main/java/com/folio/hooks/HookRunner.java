package com.folio.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the hooks registered for a hook point, one at a time, threading the context through the chain.
 * <p>
 * Order: priority descending, then aggregation order (the sort is stable). Each hook sees the context
 * produced by the previous one. A patch that touches a slot the hook point does not allow is discarded
 * and recorded in {@code errors}; a hook that throws is logged and recorded the same way, and the chain
 * continues. Same hooks and same input context always give the same result.
 */
public final class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private static final Comparator<HookDeclaration> BY_PRIORITY =
            Comparator.comparingInt(HookDeclaration::getPriority).reversed();

    private final HookInterface hookInterface;
    private final Map<String, List<HookDeclaration>> hooksByPoint;
    private final boolean debug;

    /**
     * @param hooks         validated hooks in aggregation order
     * @param hookInterface catalog used to resolve hook points and their mutable slots
     * @param debug         log every hook execution at info level
     */
    public HookRunner(List<HookDeclaration> hooks, HookInterface hookInterface, boolean debug) {
        this.hookInterface = Objects.requireNonNull(hookInterface, "hookInterface");
        this.debug = debug;
        Map<String, List<HookDeclaration>> byPoint = new LinkedHashMap<>();
        if (hooks != null) {
            for (HookDeclaration h : hooks) {
                byPoint.computeIfAbsent(h.getHook(), k -> new ArrayList<>()).add(h);
            }
        }
        byPoint.replaceAll((k, list) -> {
            list.sort(BY_PRIORITY);
            return Collections.unmodifiableList(list);
        });
        this.hooksByPoint = Collections.unmodifiableMap(byPoint);
    }

    public HookInterface getHookInterface() {
        return hookInterface;
    }

    /** Hooks that will run for the point, in execution order. */
    public List<HookDeclaration> hooksFor(String hookName) {
        return hooksByPoint.getOrDefault(hookName, List.of());
    }

    public boolean hasHooks(String hookName) {
        return !hooksFor(hookName).isEmpty();
    }

    /**
     * Runs every hook registered for {@code hookName}.
     *
     * @param hookName hook point name
     * @param context  context before the first hook
     * @return context after the last hook
     * @throws IllegalArgumentException if the hook point is not in the interface
     */
    public PipelineContext run(String hookName, PipelineContext context) {
        Objects.requireNonNull(context, "context");
        HookPoint point = hookInterface.get(hookName);
        if (point == null) {
            throw new IllegalArgumentException("Unknown hook point: " + hookName);
        }
        List<HookDeclaration> hooks = hooksFor(hookName);
        PipelineContext current = context;
        for (HookDeclaration hook : hooks) {
            long start = System.nanoTime();
            HookPatch patch;
            try {
                patch = hook.getRun().run(current);
            } catch (Exception e) {
                log.warn("Hook {} ({}) failed in '{}'; continuing", hook.getName(), hook.getProvenance(), hookName, e);
                current = current.withErrorAdded(new HookError(hookName, hook.getName(), String.valueOf(e.getMessage())));
                continue;
            }
            if (patch != null && !patch.isEmpty()) {
                Set<HookSlot> illegal = EnumSet.noneOf(HookSlot.class);
                illegal.addAll(patch.slots());
                illegal.removeAll(point.getMutable());
                if (!illegal.isEmpty()) {
                    log.error("Hook {} ({}) tried to change {} in '{}'; only {} may change there. Change discarded.",
                            hook.getName(), hook.getProvenance(), illegal, hookName, point.getMutable());
                    current = current.withErrorAdded(new HookError(hookName, hook.getName(),
                            "attempted to change non-mutable slots " + illegal));
                    continue;
                }
                current = patch.applyTo(current);
            }
            if (debug) {
                log.info("Hook {} ran in '{}' ({} ms){}", hook.getName(), hookName,
                        (System.nanoTime() - start) / 1_000_000,
                        patch != null && !patch.isEmpty() ? ", changed " + patch.slots() : "");
            }
        }
        return current;
    }
}
