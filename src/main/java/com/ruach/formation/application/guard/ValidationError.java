package com.ruach.formation.application.guard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single unmet validation rule with enough context to render precise
 * feedback.
 * <p>
 * Validation errors are values, not exceptions: validators return them
 * inside a {@link ValidationResult} and callers branch on the result.
 * </p>
 */
public final class ValidationError {

    public static final String REQUIRED = "required";
    public static final String MIN_WORDS = "min_words";
    public static final String INSUFFICIENT_CONTENT = "insufficient_content";
    public static final String INSUFFICIENT_DWELL = "insufficient_dwell";
    public static final String INVALID_FORMAT = "invalid_format";
    public static final String UNKNOWN_CHECKPOINT = "unknown_checkpoint";
    public static final String CHECKPOINT_NOT_REACHED = "checkpoint_not_reached";

    private final String field;
    private final String code;
    private final String message;
    private final Map<String, Object> details;

    public ValidationError(String field, String code, String message, Map<String, Object> details) {
        if (field == null || code == null || message == null) {
            throw new IllegalArgumentException("field, code and message cannot be null");
        }
        this.field = field;
        this.code = code;
        this.message = message;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public ValidationError(String field, String code, String message) {
        this(field, code, message, null);
    }

    public String getField() {
        return field;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ValidationError that = (ValidationError) o;
        return field.equals(that.field) && code.equals(that.code)
                && message.equals(that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, code, message, details);
    }

    @Override
    public String toString() {
        return "ValidationError{field='" + field + "', code='" + code + "', message='" + message + "'}";
    }
}
