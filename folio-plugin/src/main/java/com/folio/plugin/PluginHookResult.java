package com.folio.plugin;

import com.folio.hooks.HookPatch;

/**
 * What a plugin hook returns: the context change, and optionally the plugin's updated instance, which
 * the next invocation of any of the plugin's hooks will see. A null {@code plugin} keeps the current one.
 */
public record PluginHookResult(HookPatch patch, PluginInstance plugin) {

    public PluginHookResult {
        patch = patch != null ? patch : HookPatch.none();
    }

    public static PluginHookResult of(HookPatch patch) {
        return new PluginHookResult(patch, null);
    }

    public static PluginHookResult of(HookPatch patch, PluginInstance plugin) {
        return new PluginHookResult(patch, plugin);
    }

    public static PluginHookResult unchanged() {
        return new PluginHookResult(HookPatch.none(), null);
    }
}
