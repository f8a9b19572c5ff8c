package com.geoengine.plugin;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating settings or analysis parameters. Valid exactly when there are no errors.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = errors;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String... errors) {
        return of(Arrays.asList(errors));
    }

    /** Invalid when {@code errors} is non-empty, valid otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? VALID : new ValidationResult(List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /** Errors joined with "; ", empty when valid. */
    public Optional<String> getMessage() {
        return isValid() ? Optional.empty() : Optional.of(String.join("; ", errors));
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid" + errors;
    }
}
