package com.folio.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating a hook, route or plugin declaration: valid, or the list of problems found.
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    private final boolean valid;
    private final List<String> errors;

    private ValidationResult(boolean valid, List<String> errors) {
        this.valid = valid;
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(List<String> errors) {
        return new ValidationResult(false, errors != null ? errors : List.of());
    }

    public static ValidationResult failure(String singleError) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(singleError, "singleError")));
    }

    /** Success when {@code errors} is empty, failure otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? SUCCESS : failure(errors);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return valid ? "valid" : String.join("; ", errors);
    }
}
