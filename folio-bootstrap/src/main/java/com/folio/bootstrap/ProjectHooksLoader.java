package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Finds the project's hooks through {@link ProjectHooks} providers and tags them
 * {@link Provenance#hooksFile()}.
 */
public final class ProjectHooksLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectHooksLoader.class);

    private final ClassLoader classLoader;

    public ProjectHooksLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * @param automagicDebug log what was discovered
     */
    public List<HookDeclaration> discover(boolean automagicDebug) {
        List<HookDeclaration> out = new ArrayList<>();
        for (ProjectHooks provider : ServiceLoader.load(ProjectHooks.class, classLoader)) {
            List<HookDeclaration> hooks = provider.hooks();
            if (hooks == null) continue;
            for (HookDeclaration hook : hooks) {
                if (hook != null) out.add(hook.withProvenance(Provenance.hooksFile()));
            }
            if (automagicDebug) {
                log.info("Discovered {} project hook(s) from {}", hooks.size(), provider.getClass().getName());
            }
        }
        if (automagicDebug && out.isEmpty()) {
            log.info("No project hooks found; register a {} provider to add some", ProjectHooks.class.getName());
        }
        return out;
    }

    /** Tags hooks passed in directly. */
    public static List<HookDeclaration> tag(List<HookDeclaration> hooks) {
        List<HookDeclaration> out = new ArrayList<>();
        for (HookDeclaration hook : hooks) {
            if (hook != null) out.add(hook.withProvenance(Provenance.hooksFile()));
        }
        return out;
    }
}
