package com.folio.plugin;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookSlot;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A hook declared by a plugin. Same fields as {@link HookDeclaration}, but the body also receives and
 * may replace the plugin's instance. Turned into a regular hook by {@link PluginHookAdapter}.
 */
public final class PluginHookDeclaration {

    private final String hook;
    private final String name;
    private final String description;
    private final int priority;
    private final Set<HookSlot> mutates;
    private final PluginHookFunction run;

    private PluginHookDeclaration(Builder b) {
        this.hook = b.hook;
        this.name = b.name;
        this.description = b.description;
        this.priority = b.priority;
        this.mutates = b.mutates.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(b.mutates));
        this.run = b.run;
    }

    public String getHook() {
        return hook;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getPriority() {
        return priority;
    }

    public Set<HookSlot> getMutates() {
        return mutates;
    }

    public PluginHookFunction getRun() {
        return run;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PluginHookDeclaration{hook=" + hook + ", name=" + name + ", priority=" + priority + "}";
    }

    public static final class Builder {
        private String hook;
        private String name;
        private String description;
        private int priority = HookDeclaration.DEFAULT_PRIORITY;
        private Set<HookSlot> mutates = EnumSet.noneOf(HookSlot.class);
        private PluginHookFunction run;

        public Builder hook(String hook) {
            this.hook = hook;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder mutates(HookSlot... slots) {
            return mutates(slots != null ? Arrays.asList(slots) : null);
        }

        public Builder mutates(Collection<HookSlot> slots) {
            this.mutates = slots == null || slots.isEmpty() ? EnumSet.noneOf(HookSlot.class) : EnumSet.copyOf(slots);
            return this;
        }

        public Builder run(PluginHookFunction run) {
            this.run = run;
            return this;
        }

        public PluginHookDeclaration build() {
            return new PluginHookDeclaration(this);
        }
    }
}
