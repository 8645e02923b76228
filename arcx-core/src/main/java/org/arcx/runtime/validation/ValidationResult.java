package org.arcx.runtime.validation;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of a validation. {@code valid} is true iff there are no errors.
 */
@ToString
public class ValidationResult {
    @Getter
    private final boolean valid;
    private final Map<String, List<String>> errors;

    private ValidationResult(Map<String, List<String>> errors) {
        this.valid = errors.isEmpty();
        this.errors = errors;
    }

    public static ValidationResult success() {
        return new ValidationResult(Map.of());
    }

    public static ValidationResult failure(String field, String message) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        errors.put(field, List.of(message));
        return new ValidationResult(Collections.unmodifiableMap(errors));
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public List<String> errorsFor(String field) {
        return errors.getOrDefault(field, List.of());
    }

    public String getErrorMessage() {
        if (valid) return null;

        StringBuilder sb = new StringBuilder("Validation failed: ");
        errors.forEach((field, messages) ->
                sb.append(field).append(" - ").append(String.join(", ", messages)).append("; "));
        return sb.toString();
    }
}
