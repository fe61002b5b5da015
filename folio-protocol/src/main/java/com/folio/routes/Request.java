package com.folio.routes;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.folio.config.BuildContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of output produced by a route's {@code all}. {@code slug} is set at creation;
 * {@code route}, {@code permalink} and {@code type} are assigned during bootstrap. Two requests with
 * the same slug on different routes are distinct; output identity is the resolved permalink.
 * Immutable: the {@code with*} methods return copies.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"route", "slug", "permalink", "type"})
public final class Request {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final String route;
    private final String slug;
    private final String permalink;
    private final BuildContext type;
    private final Map<String, Object> attributes;

    private Request(String route, String slug, String permalink, BuildContext type, Map<String, ?> attributes) {
        this.route = route;
        this.slug = slug;
        this.permalink = permalink;
        this.type = type;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    /** Request with the given slug and no extra fields. */
    public static Request of(String slug) {
        return new Request(null, slug, null, null, null);
    }

    /** Request with the given slug and route-supplied fields (e.g. an id used by the route's data). */
    public static Request of(String slug, Map<String, ?> attributes) {
        return new Request(null, slug, null, null, attributes);
    }

    /** Request without a slug; only useful to represent malformed route output. */
    public static Request withoutSlug(Map<String, ?> attributes) {
        return new Request(null, null, null, null, attributes);
    }

    /** Reads the JSON form written by {@link #toJson()}; unknown fields become attributes. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Request fromJson(Map<String, Object> fields) {
        Map<String, Object> attributes = new LinkedHashMap<>(fields);
        Object route = attributes.remove("route");
        Object slug = attributes.remove("slug");
        Object permalink = attributes.remove("permalink");
        Object type = attributes.remove("type");
        return new Request(route != null ? route.toString() : null, slug != null ? slug.toString() : null,
                permalink != null ? permalink.toString() : null,
                type != null ? BuildContext.fromName(type.toString()) : null, attributes);
    }

    @JsonProperty("route")
    public String getRoute() {
        return route;
    }

    @JsonProperty("slug")
    public String getSlug() {
        return slug;
    }

    public boolean hasSlug() {
        return slug != null;
    }

    @JsonProperty("permalink")
    public String getPermalink() {
        return permalink;
    }

    /** Context the request was resolved for; null until bootstrap assigns it. */
    public BuildContext getType() {
        return type;
    }

    @JsonProperty("type")
    String getTypeName() {
        return type != null ? type.wireName() : null;
    }

    /** Route-supplied fields. Unmodifiable. */
    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public Request withRoute(String route) {
        return new Request(route, slug, permalink, type, attributes);
    }

    public Request withPermalink(String permalink) {
        return new Request(route, slug, permalink, type, attributes);
    }

    public Request withType(BuildContext type) {
        return new Request(route, slug, permalink, type, attributes);
    }

    public Request withAttribute(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(attributes);
        next.put(Objects.requireNonNull(key, "key"), value);
        return new Request(route, slug, permalink, type, next);
    }

    /** Full payload as JSON, for error messages and logs. Falls back to {@link #toString()}. */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Request)) return false;
        Request other = (Request) o;
        return Objects.equals(route, other.route) && Objects.equals(slug, other.slug)
                && Objects.equals(permalink, other.permalink) && type == other.type
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(route, slug, permalink, type, attributes);
    }

    @Override
    public String toString() {
        return "Request{route=" + route + ", slug=" + slug + ", permalink=" + permalink + ", type=" + type
                + (attributes.isEmpty() ? "" : ", attributes=" + attributes) + "}";
    }
}
