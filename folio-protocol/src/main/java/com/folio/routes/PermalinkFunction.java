package com.folio.routes;

import com.folio.config.SettingsView;

/**
 * Maps a request to its output path. Must be pure: the same request and settings always give the same
 * permalink.
 */
@FunctionalInterface
public interface PermalinkFunction {

    String permalink(Request request, SettingsView settings);
}
