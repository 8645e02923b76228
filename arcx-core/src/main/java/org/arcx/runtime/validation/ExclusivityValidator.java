package org.arcx.runtime.validation;

import org.arcx.model.ActiveKeyState;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.Relation;
import org.arcx.runtime.ActiveKeyResolver;
import org.arcx.runtime.AttributeReader;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pre-save check of the exclusivity invariant. The error is attached to the role, not to a
 * column. The database trigger stays the authoritative check; this one only gives callers a
 * readable error before a write is attempted.
 */
public class ExclusivityValidator {
    private final PolymorphicMapping mapping;
    private final ActiveKeyResolver resolver;

    public ExclusivityValidator(PolymorphicMapping mapping) {
        this(mapping, new ActiveKeyResolver(mapping));
    }

    public ExclusivityValidator(PolymorphicMapping mapping, ActiveKeyResolver resolver) {
        this.mapping = mapping;
        this.resolver = resolver;
    }

    public ValidationResult validate(Map<String, ?> columnValues) {
        return validate(AttributeReader.of(columnValues));
    }

    public ValidationResult validate(AttributeReader reader) {
        String error = errorFor(resolver.resolve(reader));
        return error == null ? ValidationResult.success() : ValidationResult.failure(mapping.getRole(), error);
    }

    /**
     * Pushes the failure, if any, into the host's sink.
     *
     * @return whether the entity is valid
     */
    public boolean validate(AttributeReader reader, ValidationSink sink) {
        String error = errorFor(resolver.resolve(reader));
        if (error != null) {
            sink.reject(mapping.getRole(), error);
        }
        return error == null;
    }

    private String errorFor(ActiveKeyState state) {
        if (state.isResolved()) {
            return null;
        }
        String base = "exactly one of " + mapping.getRelations().stream()
                .map(Relation::shortName)
                .collect(Collectors.joining(", "))
                + " must be present";
        if (state instanceof ActiveKeyState.Conflict conflict) {
            return base + " (found " + String.join(", ", conflict.setColumns()) + ")";
        }
        return base;
    }
}
