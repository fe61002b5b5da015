package com.folio.hooks;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One entry of the {@link HookInterface}: a named moment in the pipeline with the slots
 * hooks registered there may read and change.
 */
public final class HookPoint {

    private final String name;
    private final String context;
    private final Set<HookSlot> props;
    private final Set<HookSlot> mutable;
    private final boolean experimental;

    public HookPoint(String name, String context, Set<HookSlot> props, Set<HookSlot> mutable, boolean experimental) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("Hook point name must be non-blank");
        this.context = context != null ? context : "";
        this.props = props == null || props.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(props));
        this.mutable = mutable == null || mutable.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(mutable));
        if (!this.props.containsAll(this.mutable)) {
            throw new IllegalArgumentException("Hook point " + name + " declares mutable slots it does not expose: "
                    + mutable + " vs " + props);
        }
        this.experimental = experimental;
    }

    public String getName() {
        return name;
    }

    /** When the hook point fires. */
    public String getContext() {
        return context;
    }

    /** Readable slots. */
    public Set<HookSlot> getProps() {
        return props;
    }

    /** Slots a hook may change at this point. Always a subset of {@link #getProps()}. */
    public Set<HookSlot> getMutable() {
        return mutable;
    }

    public boolean isExperimental() {
        return experimental;
    }

    public boolean isMutable(HookSlot slot) {
        return mutable.contains(slot);
    }

    @Override
    public String toString() {
        return "HookPoint{" + name + ", mutable=" + mutable + "}";
    }
}
