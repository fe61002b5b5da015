package com.folio.hooks;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A hook as declared by a plugin, route, hooks file or folio itself. Immutable; not validated on
 * construction (see {@link HookValidator}), so a malformed declaration can be reported and dropped
 * instead of failing the build.
 */
public final class HookDeclaration {

    public static final int DEFAULT_PRIORITY = 50;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 100;

    private final String hook;
    private final String name;
    private final String description;
    private final int priority;
    private final Set<HookSlot> mutates;
    private final HookFunction run;
    private final Provenance provenance;

    private HookDeclaration(Builder b) {
        this.hook = b.hook;
        this.name = b.name;
        this.description = b.description;
        this.priority = b.priority;
        this.mutates = b.mutates.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(b.mutates));
        this.run = b.run;
        this.provenance = b.provenance;
    }

    /** Hook point this hook registers for (must exist in the {@link HookInterface}). */
    public String getHook() {
        return hook;
    }

    /** Unique, human-readable identifier; used by the disable list. */
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** 1..100, higher runs first; hooks of equal priority run in aggregation order. */
    public int getPriority() {
        return priority;
    }

    /** Slots this hook declares it may change; must all be mutable at {@link #getHook()}. */
    public Set<HookSlot> getMutates() {
        return mutates;
    }

    public HookFunction getRun() {
        return run;
    }

    /** Null until the collector tags the hook. */
    public Provenance getProvenance() {
        return provenance;
    }

    public HookDeclaration withProvenance(Provenance provenance) {
        return toBuilder().provenance(provenance).build();
    }

    public HookDeclaration withRun(HookFunction run) {
        return toBuilder().run(run).build();
    }

    public Builder toBuilder() {
        return builder()
                .hook(hook)
                .name(name)
                .description(description)
                .priority(priority)
                .mutates(mutates)
                .run(run)
                .provenance(provenance);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "HookDeclaration{hook=" + hook + ", name=" + name + ", priority=" + priority
                + ", provenance=" + provenance + "}";
    }

    public static final class Builder {
        private String hook;
        private String name;
        private String description;
        private int priority = DEFAULT_PRIORITY;
        private Set<HookSlot> mutates = EnumSet.noneOf(HookSlot.class);
        private HookFunction run;
        private Provenance provenance;

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

        public Builder run(HookFunction run) {
            this.run = run;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public HookDeclaration build() {
            return new HookDeclaration(this);
        }
    }
}
