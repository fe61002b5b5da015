package com.folio.routes;

import com.folio.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shape check for merged routes. Failing routes are logged and excluded; they never stop the pipeline.
 */
public final class RouteValidator {

    private static final Logger log = LoggerFactory.getLogger(RouteValidator.class);

    public ValidationResult check(RouteDefinition route) {
        if (route == null) return ValidationResult.failure("route is null");
        List<String> errors = new ArrayList<>();
        if (route.getName() == null || route.getName().isBlank()) {
            errors.add("'name' is required");
        }
        if (route.getAll() == null) {
            errors.add("'all' is required (a function or a list of requests)");
        }
        if (route.getPermalink() == null) {
            errors.add("'permalink' is required");
        }
        if ((route.getTemplate() == null || route.getTemplate().isBlank()) && route.getTemplateComponent() == null) {
            errors.add("'template' is required");
        }
        return ValidationResult.of(errors);
    }

    /**
     * @param route     route to check
     * @param routeName key the route is registered under (used in the warning)
     * @return the route when valid, otherwise empty after logging why
     */
    public Optional<RouteDefinition> validate(RouteDefinition route, String routeName) {
        ValidationResult result = check(route);
        if (result.isValid()) return Optional.of(route);
        log.warn("Route {} (added by {}) is invalid and will be skipped: {}",
                routeName, route != null ? route.getProvenance() : null, result);
        return Optional.empty();
    }
}
