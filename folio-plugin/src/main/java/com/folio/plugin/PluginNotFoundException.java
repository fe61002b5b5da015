package com.folio.plugin;

import com.folio.errors.BootstrapException;

import java.util.List;

/**
 * A configured plugin was not found in any lookup location.
 */
public final class PluginNotFoundException extends BootstrapException {

    private final String pluginName;
    private final List<String> searched;

    public PluginNotFoundException(String pluginName, List<String> searched) {
        super("Plugin '" + pluginName + "' not found. Searched: " + String.join(", ", searched)
                + ". Is it installed and does its provider report this name?");
        this.pluginName = pluginName;
        this.searched = List.copyOf(searched);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getSearched() {
        return searched;
    }
}
