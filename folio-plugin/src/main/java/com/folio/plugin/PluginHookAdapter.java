package com.folio.plugin;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.Provenance;

/**
 * Turns plugin hooks into regular {@link HookDeclaration}s. The adapted body reads the plugin's current
 * instance from the {@link PluginStateStore}, runs the plugin hook, stores the returned instance (if any)
 * and hands only the patch to the hook chain.
 */
public final class PluginHookAdapter {

    private final PluginStateStore store;

    public PluginHookAdapter(PluginStateStore store) {
        this.store = store;
    }

    public HookDeclaration adapt(String pluginName, PluginHookDeclaration hook) {
        PluginHookFunction body = hook.getRun();
        return HookDeclaration.builder()
                .hook(hook.getHook())
                .name(hook.getName())
                .description(hook.getDescription())
                .priority(hook.getPriority())
                .mutates(hook.getMutates())
                .run(body == null ? null : context -> {
                    PluginHookResult result = body.run(store.get(pluginName), context);
                    if (result == null) return null;
                    if (result.plugin() != null) {
                        if (!pluginName.equals(result.plugin().getName())) {
                            throw new IllegalStateException("Hook " + hook.getName() + " returned state for plugin '"
                                    + result.plugin().getName() + "', expected '" + pluginName + "'");
                        }
                        store.put(result.plugin());
                    }
                    return result.patch();
                })
                .provenance(Provenance.plugin(pluginName))
                .build();
    }
}
