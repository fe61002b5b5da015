package com.folio.hooks;

import com.folio.routes.Request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed change a hook returns to the {@link HookRunner}. Each variant replaces exactly one slot of the
 * {@link PipelineContext}; {@link #of(HookPatch...)} combines several. The runner checks
 * {@link #slots()} against the hook point's mutable slots before {@link #applyTo(PipelineContext) applying}.
 * Variants are fixed: the constructor is package-private.
 */
public abstract class HookPatch {

    private static final HookPatch NONE = new Composite(List.of());

    HookPatch() {
    }

    /** Slots this patch replaces. */
    public abstract Set<HookSlot> slots();

    /** Returns a new context with this patch applied. */
    public abstract PipelineContext applyTo(PipelineContext context);

    public boolean isEmpty() {
        return slots().isEmpty();
    }

    /** Leaves the context unchanged. */
    public static HookPatch none() {
        return NONE;
    }

    public static HookPatch data(Map<String, ?> data) {
        return new Data(data);
    }

    public static HookPatch customProps(Map<String, ?> customProps) {
        return new CustomProps(customProps);
    }

    public static HookPatch query(Map<String, ?> query) {
        return new Query(query);
    }

    public static HookPatch allRequests(List<Request> allRequests) {
        return new AllRequests(allRequests);
    }

    public static HookPatch hookInterface(HookInterface hookInterface) {
        return new ReplaceHookInterface(hookInterface);
    }

    public static HookPatch errors(List<HookError> errors) {
        return new Errors(errors);
    }

    /** Applies the given patches in order. */
    public static HookPatch of(HookPatch... patches) {
        List<HookPatch> list = new ArrayList<>();
        if (patches != null) {
            for (HookPatch p : patches) {
                if (p != null && !p.isEmpty()) list.add(p);
            }
        }
        return list.isEmpty() ? NONE : new Composite(list);
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    static final class Data extends HookPatch {
        private final Map<String, Object> data;

        Data(Map<String, ?> data) {
            this.data = copy(data);
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.DATA);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withData(data);
        }
    }

    static final class CustomProps extends HookPatch {
        private final Map<String, Object> customProps;

        CustomProps(Map<String, ?> customProps) {
            this.customProps = copy(customProps);
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.CUSTOM_PROPS);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withCustomProps(customProps);
        }
    }

    static final class Query extends HookPatch {
        private final Map<String, Object> query;

        Query(Map<String, ?> query) {
            this.query = copy(query);
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.QUERY);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withQuery(query);
        }
    }

    static final class AllRequests extends HookPatch {
        private final List<Request> allRequests;

        AllRequests(List<Request> allRequests) {
            this.allRequests = List.copyOf(Objects.requireNonNull(allRequests, "allRequests"));
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.ALL_REQUESTS);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withAllRequests(allRequests);
        }
    }

    static final class ReplaceHookInterface extends HookPatch {
        private final HookInterface hookInterface;

        ReplaceHookInterface(HookInterface hookInterface) {
            this.hookInterface = Objects.requireNonNull(hookInterface, "hookInterface");
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.HOOK_INTERFACE);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withHookInterface(hookInterface);
        }
    }

    static final class Errors extends HookPatch {
        private final List<HookError> errors;

        Errors(List<HookError> errors) {
            this.errors = errors != null ? List.copyOf(errors) : List.of();
        }

        @Override
        public Set<HookSlot> slots() {
            return EnumSet.of(HookSlot.ERRORS);
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            return context.withErrors(errors);
        }
    }

    static final class Composite extends HookPatch {
        private final List<HookPatch> patches;

        Composite(List<HookPatch> patches) {
            this.patches = List.copyOf(patches);
        }

        @Override
        public Set<HookSlot> slots() {
            Set<HookSlot> out = EnumSet.noneOf(HookSlot.class);
            for (HookPatch p : patches) out.addAll(p.slots());
            return out;
        }

        @Override
        public PipelineContext applyTo(PipelineContext context) {
            PipelineContext current = context;
            for (HookPatch p : patches) current = p.applyTo(current);
            return current;
        }
    }
}
