package com.folio.plugin;

import com.folio.hooks.PipelineContext;

/**
 * Body of a plugin hook. Gets the plugin's current instance next to the pipeline context.
 */
@FunctionalInterface
public interface PluginHookFunction {

    PluginHookResult run(PluginInstance plugin, PipelineContext context) throws Exception;
}
