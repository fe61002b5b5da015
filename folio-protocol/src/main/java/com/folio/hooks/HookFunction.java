package com.folio.hooks;

/**
 * Body of a hook. Receives the current (immutable) context and returns the changes it wants,
 * or {@code null} / {@link HookPatch#none()} to leave the context unchanged.
 */
@FunctionalInterface
public interface HookFunction {

    HookPatch run(PipelineContext context) throws Exception;
}
