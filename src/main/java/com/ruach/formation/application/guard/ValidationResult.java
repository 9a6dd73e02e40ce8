package com.ruach.formation.application.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validator: valid, or the list of unmet rules.
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(List.of());

    private final List<ValidationError> errors;

    private ValidationResult(List<ValidationError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return errors == null || errors.isEmpty() ? OK : new ValidationResult(errors);
    }

    public static ValidationResult failure(ValidationError error) {
        return new ValidationResult(List.of(error));
    }

    /**
     * @return a result holding the errors of both, in order
     */
    public ValidationResult and(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (isValid()) {
            return other;
        }
        List<ValidationError> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ValidationResult(merged);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * @return the first error, or null when valid
     */
    public ValidationError getError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + "}";
    }
}
