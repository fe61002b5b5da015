package com.folio.hooks;

/**
 * Named slot of the data a hook point exposes. Hook points declare which slots are readable
 * ({@link HookPoint#getProps()}) and which may be changed through a {@link HookPatch}
 * ({@link HookPoint#getMutable()}).
 */
public enum HookSlot {
    HOOK_INTERFACE("hookInterface"),
    CUSTOM_PROPS("customProps"),
    ERRORS("errors"),
    DATA("data"),
    QUERY("query"),
    HELPERS("helpers"),
    SETTINGS("settings"),
    ROUTES("routes"),
    HOOKS("hooks"),
    ALL_REQUESTS("allRequests"),
    REQUEST("request"),
    ROUTE("route"),
    HEAD_STACK("headStack"),
    CSS_STACK("cssStack"),
    HYDRATE_STACK("hydrateStack"),
    FOOTER_STACK("footerStack"),
    LAYOUT_HTML("layoutHtml"),
    HEAD_STRING("headString"),
    HTML_STRING("htmlString"),
    TIMINGS("timings");

    private final String slotName;

    HookSlot(String slotName) {
        this.slotName = slotName;
    }

    /** Camel-case name as used in hook documentation and logs. */
    public String slotName() {
        return slotName;
    }
}
