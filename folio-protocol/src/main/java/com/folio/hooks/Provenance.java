package com.folio.hooks;

import java.util.Locale;
import java.util.Objects;

/**
 * Provenance metadata attached to every hook and route: the kind of source and who added it.
 */
public record Provenance(SourceType type, String addedBy) {

    public Provenance {
        Objects.requireNonNull(type, "type");
        addedBy = addedBy != null ? addedBy : "";
    }

    public static Provenance internal() {
        return new Provenance(SourceType.INTERNAL, "folio");
    }

    public static Provenance plugin(String pluginName) {
        return new Provenance(SourceType.PLUGIN, pluginName);
    }

    public static Provenance route(String addedBy) {
        return new Provenance(SourceType.ROUTE, addedBy);
    }

    public static Provenance hooksFile() {
        return new Provenance(SourceType.HOOKS_FILE, "hooks");
    }

    public boolean isPlugin() {
        return type == SourceType.PLUGIN;
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + addedBy;
    }
}
