package com.folio.plugin;

import com.folio.routes.RouteDefinition;
import com.folio.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shape check for an initialized plugin. Individual hooks are checked later by the hook validator, like
 * every other hook, and a bad one is dropped with a warning rather than failing the plugin.
 */
public final class PluginValidator {

    public ValidationResult check(PluginDefinition plugin) {
        if (plugin == null) return ValidationResult.failure("definition is null");
        List<String> errors = new ArrayList<>();
        if (plugin.getName() == null || plugin.getName().isBlank()) {
            errors.add("'name' is required");
        }
        int i = 0;
        for (PluginHookDeclaration hook : plugin.getHooks()) {
            String at = "hooks[" + i++ + "]";
            if (hook == null) errors.add(at + " is null");
        }
        for (Map.Entry<String, RouteDefinition> e : plugin.getRoutes().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) errors.add("route with blank name");
            if (e.getValue() == null) errors.add("route '" + e.getKey() + "' is null");
        }
        return ValidationResult.of(errors);
    }

    /**
     * @throws PluginValidationException listing every problem found
     */
    public PluginDefinition validate(PluginDefinition plugin, String expectedName) {
        ValidationResult result = check(plugin);
        if (!result.isValid()) {
            throw new PluginValidationException(expectedName, result.getErrors());
        }
        return plugin;
    }
}
