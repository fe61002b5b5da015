package com.folio.hooks;

import com.folio.config.SettingsView;
import com.folio.routes.PermalinkHelper;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state of the pipeline as seen by hooks. Every change produces a new instance; hooks
 * request changes only by returning a {@link HookPatch}, so no hook can keep and mutate a shared
 * reference. Collections are unmodifiable (shallow: values supplied by user code are kept as-is).
 */
public final class PipelineContext {

    private final SettingsView settings;
    private final Map<String, RouteDefinition> routes;
    private final List<HookDeclaration> hooks;
    private final HookInterface hookInterface;
    private final Map<String, Object> data;
    private final Map<String, Object> customProps;
    private final Map<String, Object> query;
    private final List<Request> allRequests;
    private final List<HookError> errors;
    private final PermalinkHelper helpers;

    private PipelineContext(Builder b) {
        this.settings = Objects.requireNonNull(b.settings, "settings");
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(b.routes));
        this.hooks = List.copyOf(b.hooks);
        this.hookInterface = b.hookInterface != null ? b.hookInterface : HookInterface.defaults();
        this.data = unmodifiable(b.data);
        this.customProps = unmodifiable(b.customProps);
        this.query = unmodifiable(b.query);
        this.allRequests = List.copyOf(b.allRequests);
        this.errors = List.copyOf(b.errors);
        this.helpers = new PermalinkHelper(this.routes, this.settings);
    }

    private static Map<String, Object> unmodifiable(Map<String, ?> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public SettingsView getSettings() {
        return settings;
    }

    /** Validated routes by name, in merge order. */
    public Map<String, RouteDefinition> getRoutes() {
        return routes;
    }

    /** Final, validated hook list in aggregation order. */
    public List<HookDeclaration> getHooks() {
        return hooks;
    }

    public HookInterface getHookInterface() {
        return hookInterface;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Map<String, Object> getCustomProps() {
        return customProps;
    }

    /** Project-defined query handles (e.g. data-source clients) populated during bootstrap. */
    public Map<String, Object> getQuery() {
        return query;
    }

    public List<Request> getAllRequests() {
        return allRequests;
    }

    public List<HookError> getErrors() {
        return errors;
    }

    /** Permalink helpers over the current routes and settings. */
    public PermalinkHelper getHelpers() {
        return helpers;
    }

    public PipelineContext withData(Map<String, ?> data) {
        return toBuilder().data(data).build();
    }

    public PipelineContext withCustomProps(Map<String, ?> customProps) {
        return toBuilder().customProps(customProps).build();
    }

    public PipelineContext withQuery(Map<String, ?> query) {
        return toBuilder().query(query).build();
    }

    public PipelineContext withAllRequests(List<Request> allRequests) {
        return toBuilder().allRequests(allRequests).build();
    }

    public PipelineContext withHookInterface(HookInterface hookInterface) {
        return toBuilder().hookInterface(hookInterface).build();
    }

    public PipelineContext withErrors(List<HookError> errors) {
        return toBuilder().errors(errors).build();
    }

    public PipelineContext withErrorAdded(HookError error) {
        List<HookError> next = new ArrayList<>(errors);
        next.add(Objects.requireNonNull(error, "error"));
        return toBuilder().errors(next).build();
    }

    public Builder toBuilder() {
        return builder()
                .settings(settings)
                .routes(routes)
                .hooks(hooks)
                .hookInterface(hookInterface)
                .data(data)
                .customProps(customProps)
                .query(query)
                .allRequests(allRequests)
                .errors(errors);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineContext{routes=" + routes.keySet() + ", hooks=" + hooks.size()
                + ", requests=" + allRequests.size() + ", errors=" + errors.size() + "}";
    }

    public static final class Builder {
        private SettingsView settings;
        private Map<String, RouteDefinition> routes = Map.of();
        private List<HookDeclaration> hooks = List.of();
        private HookInterface hookInterface;
        private Map<String, ?> data = Map.of();
        private Map<String, ?> customProps = Map.of();
        private Map<String, ?> query = Map.of();
        private List<Request> allRequests = List.of();
        private List<HookError> errors = List.of();

        public Builder settings(SettingsView settings) {
            this.settings = settings;
            return this;
        }

        public Builder routes(Map<String, RouteDefinition> routes) {
            this.routes = routes != null ? routes : Map.of();
            return this;
        }

        public Builder hooks(List<HookDeclaration> hooks) {
            this.hooks = hooks != null ? hooks : List.of();
            return this;
        }

        public Builder hookInterface(HookInterface hookInterface) {
            this.hookInterface = hookInterface;
            return this;
        }

        public Builder data(Map<String, ?> data) {
            this.data = data;
            return this;
        }

        public Builder customProps(Map<String, ?> customProps) {
            this.customProps = customProps;
            return this;
        }

        public Builder query(Map<String, ?> query) {
            this.query = query;
            return this;
        }

        public Builder allRequests(List<Request> allRequests) {
            this.allRequests = allRequests != null ? allRequests : List.of();
            return this;
        }

        public Builder errors(List<HookError> errors) {
            this.errors = errors != null ? errors : List.of();
            return this;
        }

        public PipelineContext build() {
            return new PipelineContext(this);
        }
    }
}
