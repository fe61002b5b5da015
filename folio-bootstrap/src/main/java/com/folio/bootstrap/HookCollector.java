package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates hooks in source order (internal, plugin, route, project), validates them against the hook
 * interface and removes the ones named in the disable list.
 */
public final class HookCollector {

    private static final Logger log = LoggerFactory.getLogger(HookCollector.class);

    private final HookInterface hookInterface;

    public HookCollector(HookInterface hookInterface) {
        this.hookInterface = hookInterface;
    }

    public List<HookDeclaration> collect(List<HookDeclaration> internal, List<HookDeclaration> plugin,
                                         List<HookDeclaration> route, List<HookDeclaration> project,
                                         Collection<String> disabled) {
        List<HookDeclaration> all = new ArrayList<>(internal.size() + plugin.size() + route.size() + project.size());
        all.addAll(internal);
        all.addAll(plugin);
        all.addAll(route);
        all.addAll(project);

        List<HookDeclaration> valid = new HookValidator(hookInterface).validateAll(all);
        Set<String> off = disabled != null ? new HashSet<>(disabled) : Set.of();
        List<HookDeclaration> enabled = new ArrayList<>(valid.size());
        for (HookDeclaration hook : valid) {
            if (off.contains(hook.getName())) {
                log.info("Hook {} ({}) is disabled by settings", hook.getName(), hook.getProvenance());
            } else {
                enabled.add(hook);
            }
        }
        log.debug("Collected {} hook(s), {} invalid, {} disabled", all.size(), all.size() - valid.size(),
                valid.size() - enabled.size());
        return enabled;
    }
}
