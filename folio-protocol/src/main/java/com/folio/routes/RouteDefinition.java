package com.folio.routes;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.Provenance;

import java.util.List;

/**
 * A declared content type: how to enumerate its requests, how to build each permalink and which template
 * renders it. Immutable; {@code with*} methods return copies. Not validated on construction
 * (see {@link RouteValidator}).
 */
public final class RouteDefinition {

    private final String name;
    private final RequestSource all;
    private final PermalinkFunction permalink;
    private final String template;
    private final TemplateComponent templateComponent;
    private final RouteDataFunction data;
    private final List<HookDeclaration> hooks;
    private final Provenance provenance;

    private RouteDefinition(Builder b) {
        this.name = b.name;
        this.all = b.all;
        this.permalink = b.permalink;
        this.template = b.template;
        this.templateComponent = b.templateComponent;
        this.data = b.data;
        this.hooks = b.hooks != null ? List.copyOf(b.hooks) : List.of();
        this.provenance = b.provenance;
    }

    public String getName() {
        return name;
    }

    public RequestSource getAll() {
        return all;
    }

    public PermalinkFunction getPermalink() {
        return permalink;
    }

    /** Template reference as declared (e.g. "Blog.svelte"). */
    public String getTemplate() {
        return template;
    }

    /** Resolved component for templated file references; null otherwise. */
    public TemplateComponent getTemplateComponent() {
        return templateComponent;
    }

    /** Null when the route declares no data function. */
    public RouteDataFunction getData() {
        return data;
    }

    /** Inline hooks declared on the route (user routes only). */
    public List<HookDeclaration> getHooks() {
        return hooks;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public RouteDefinition withName(String name) {
        return toBuilder().name(name).build();
    }

    public RouteDefinition withProvenance(Provenance provenance) {
        return toBuilder().provenance(provenance).build();
    }

    public RouteDefinition withHooks(List<HookDeclaration> hooks) {
        return toBuilder().hooks(hooks).build();
    }

    public RouteDefinition withData(RouteDataFunction data) {
        return toBuilder().data(data).build();
    }

    public RouteDefinition withTemplateComponent(TemplateComponent templateComponent) {
        return toBuilder().templateComponent(templateComponent).build();
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .all(all)
                .permalink(permalink)
                .template(template)
                .templateComponent(templateComponent)
                .data(data)
                .hooks(hooks)
                .provenance(provenance);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RouteDefinition{name=" + name + ", template=" + template + ", provenance=" + provenance + "}";
    }

    public static final class Builder {
        private String name;
        private RequestSource all;
        private PermalinkFunction permalink;
        private String template;
        private TemplateComponent templateComponent;
        private RouteDataFunction data;
        private List<HookDeclaration> hooks;
        private Provenance provenance;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder all(RequestSource all) {
            this.all = all;
            return this;
        }

        /** Literal request list instead of a function. */
        public Builder all(List<Request> requests) {
            this.all = RequestSource.literal(requests);
            return this;
        }

        public Builder permalink(PermalinkFunction permalink) {
            this.permalink = permalink;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder templateComponent(TemplateComponent templateComponent) {
            this.templateComponent = templateComponent;
            return this;
        }

        public Builder data(RouteDataFunction data) {
            this.data = data;
            return this;
        }

        public Builder hooks(List<HookDeclaration> hooks) {
            this.hooks = hooks;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public RouteDefinition build() {
            return new RouteDefinition(this);
        }
    }
}
