package com.folio.plugin;

import com.folio.errors.BootstrapException;

import java.util.List;

/**
 * A plugin definition (as returned by its provider or its initializer) is malformed.
 */
public final class PluginValidationException extends BootstrapException {

    private final String pluginName;
    private final List<String> problems;

    public PluginValidationException(String pluginName, List<String> problems) {
        super("Plugin '" + pluginName + "' is invalid: " + String.join("; ", problems));
        this.pluginName = pluginName;
        this.problems = List.copyOf(problems);
    }

    public PluginValidationException(String pluginName, String problem, Throwable cause) {
        super("Plugin '" + pluginName + "' is invalid: " + problem, cause);
        this.pluginName = pluginName;
        this.problems = List.of(problem);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getProblems() {
        return problems;
    }
}
