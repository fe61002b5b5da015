package com.folio.hooks;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.folio.hooks.HookSlot.ALL_REQUESTS;
import static com.folio.hooks.HookSlot.CSS_STACK;
import static com.folio.hooks.HookSlot.CUSTOM_PROPS;
import static com.folio.hooks.HookSlot.DATA;
import static com.folio.hooks.HookSlot.ERRORS;
import static com.folio.hooks.HookSlot.FOOTER_STACK;
import static com.folio.hooks.HookSlot.HEAD_STACK;
import static com.folio.hooks.HookSlot.HEAD_STRING;
import static com.folio.hooks.HookSlot.HELPERS;
import static com.folio.hooks.HookSlot.HOOKS;
import static com.folio.hooks.HookSlot.HOOK_INTERFACE;
import static com.folio.hooks.HookSlot.HTML_STRING;
import static com.folio.hooks.HookSlot.HYDRATE_STACK;
import static com.folio.hooks.HookSlot.LAYOUT_HTML;
import static com.folio.hooks.HookSlot.QUERY;
import static com.folio.hooks.HookSlot.REQUEST;
import static com.folio.hooks.HookSlot.ROUTE;
import static com.folio.hooks.HookSlot.ROUTES;
import static com.folio.hooks.HookSlot.SETTINGS;
import static com.folio.hooks.HookSlot.TIMINGS;

/**
 * Immutable catalog of hook points. Iteration order is the order in which the points fire.
 * {@code customizeHooks} may replace the interface through {@link HookPatch#hookInterface(HookInterface)};
 * use {@link #with(HookPoint)} to derive a changed catalog.
 */
public final class HookInterface {

    public static final String CUSTOMIZE_HOOKS = "customizeHooks";
    public static final String BOOTSTRAP = "bootstrap";
    public static final String ALL_REQUESTS_HOOK = "allRequests";
    public static final String MIDDLEWARE = "middleware";
    public static final String REQUEST_HOOK = "request";
    public static final String DATA_HOOK = "data";
    public static final String SHORTCODES = "shortcodes";
    public static final String STACKS = "stacks";
    public static final String HEAD = "head";
    public static final String COMPILE_HTML = "compileHtml";
    public static final String HTML = "html";
    public static final String REQUEST_COMPLETE = "requestComplete";
    public static final String ERROR = "error";
    public static final String BUILD_COMPLETE = "buildComplete";

    private static final HookInterface DEFAULTS = createDefaults();

    private final Map<String, HookPoint> points;

    private HookInterface(Map<String, HookPoint> points) {
        this.points = Collections.unmodifiableMap(new LinkedHashMap<>(points));
    }

    /** The built-in catalog. */
    public static HookInterface defaults() {
        return DEFAULTS;
    }

    public static HookInterface of(Collection<HookPoint> points) {
        Map<String, HookPoint> byName = new LinkedHashMap<>();
        for (HookPoint p : Objects.requireNonNull(points, "points")) {
            if (byName.putIfAbsent(p.getName(), p) != null) {
                throw new IllegalArgumentException("Duplicate hook point: " + p.getName());
            }
        }
        return new HookInterface(byName);
    }

    /** Returns the point or null if this catalog does not define it. */
    public HookPoint get(String name) {
        return name != null ? points.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && points.containsKey(name);
    }

    public Collection<HookPoint> getPoints() {
        return points.values();
    }

    /** New catalog with the given point added or replaced (position kept when replacing). */
    public HookInterface with(HookPoint point) {
        Map<String, HookPoint> copy = new LinkedHashMap<>(points);
        copy.put(point.getName(), point);
        return new HookInterface(copy);
    }

    @Override
    public String toString() {
        return "HookInterface" + points.keySet();
    }

    private static HookInterface createDefaults() {
        Map<String, HookPoint> m = new LinkedHashMap<>();
        add(m, CUSTOMIZE_HOOKS,
                "Runs first, with only non-plugin hooks. Used to change the hook interface or seed customProps.",
                EnumSet.of(HOOK_INTERFACE, CUSTOM_PROPS, ERRORS),
                EnumSet.of(HOOK_INTERFACE, CUSTOM_PROPS, ERRORS));
        add(m, BOOTSTRAP,
                "Runs once after all hooks and routes are collected; used to populate data, query or customProps.",
                EnumSet.of(HELPERS, DATA, SETTINGS, ROUTES, HOOKS, QUERY, CUSTOM_PROPS, ERRORS),
                EnumSet.of(ERRORS, DATA, QUERY, CUSTOM_PROPS));
        add(m, ALL_REQUESTS_HOOK,
                "Runs once over every request produced by every route, before permalinks are resolved.",
                EnumSet.of(HELPERS, DATA, SETTINGS, ALL_REQUESTS, ROUTES, QUERY, CUSTOM_PROPS, ERRORS),
                EnumSet.of(ALL_REQUESTS, ERRORS));
        add(m, MIDDLEWARE,
                "Server only: runs for each incoming request before it is matched to a permalink.",
                EnumSet.of(REQUEST, QUERY, SETTINGS, ROUTES, HELPERS, DATA, CUSTOM_PROPS, ERRORS),
                EnumSet.of(REQUEST, QUERY, ERRORS, CUSTOM_PROPS));
        add(m, REQUEST_HOOK,
                "Runs before a single request is rendered.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, ALL_REQUESTS, ROUTE, QUERY, CUSTOM_PROPS, ERRORS),
                EnumSet.of(ERRORS, DATA, REQUEST, ROUTE));
        add(m, DATA_HOOK,
                "Runs after a route's data function, before rendering; may add to the page stacks.",
                EnumSet.of(DATA, REQUEST, SETTINGS, HELPERS, QUERY, ROUTE, ERRORS, HEAD_STACK, CSS_STACK,
                        HYDRATE_STACK, FOOTER_STACK, CUSTOM_PROPS),
                EnumSet.of(DATA, ERRORS, HEAD_STACK, CSS_STACK, HYDRATE_STACK, FOOTER_STACK));
        add(m, SHORTCODES,
                "Runs after the layout is rendered; used to process shortcodes in the layout html.",
                EnumSet.of(LAYOUT_HTML, HELPERS, DATA, SETTINGS, REQUEST, QUERY, ERRORS, CSS_STACK, HEAD_STACK,
                        CUSTOM_PROPS),
                EnumSet.of(ERRORS, LAYOUT_HTML, CSS_STACK, HEAD_STACK));
        add(m, STACKS,
                "Runs just before the page stacks are compiled into strings.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, ERRORS, HEAD_STACK, CSS_STACK, HYDRATE_STACK,
                        FOOTER_STACK, CUSTOM_PROPS),
                EnumSet.of(ERRORS, HEAD_STACK, CSS_STACK, HYDRATE_STACK, FOOTER_STACK));
        add(m, HEAD,
                "Runs with the compiled head string.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, HEAD_STRING, QUERY, ERRORS, CUSTOM_PROPS),
                EnumSet.of(ERRORS, HEAD_STRING));
        add(m, COMPILE_HTML,
                "Compiles the html document from its parts.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, HEAD_STRING, LAYOUT_HTML, HTML_STRING, ERRORS,
                        CUSTOM_PROPS),
                EnumSet.of(ERRORS, HTML_STRING));
        add(m, HTML,
                "Runs with the final html of a request; writing it out happens here.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, HTML_STRING, QUERY, ERRORS, CUSTOM_PROPS),
                EnumSet.of(ERRORS, HTML_STRING));
        add(m, REQUEST_COMPLETE,
                "Runs after a request is built, with its timings.",
                EnumSet.of(REQUEST, HTML_STRING, QUERY, SETTINGS, ERRORS, TIMINGS, DATA, CUSTOM_PROPS),
                EnumSet.of(ERRORS));
        add(m, ERROR,
                "Runs when a request has errors.",
                EnumSet.of(HELPERS, DATA, SETTINGS, REQUEST, ERRORS, QUERY, CUSTOM_PROPS),
                EnumSet.noneOf(HookSlot.class));
        add(m, BUILD_COMPLETE,
                "Runs once after a full build completes.",
                EnumSet.of(HELPERS, DATA, SETTINGS, ROUTES, ALL_REQUESTS, ERRORS, QUERY, TIMINGS, CUSTOM_PROPS),
                EnumSet.noneOf(HookSlot.class));
        return new HookInterface(m);
    }

    private static void add(Map<String, HookPoint> m, String name, String context,
                            EnumSet<HookSlot> props, EnumSet<HookSlot> mutable) {
        m.put(name, new HookPoint(name, context, props, mutable, false));
    }
}
