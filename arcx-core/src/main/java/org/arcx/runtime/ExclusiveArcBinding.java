package org.arcx.runtime;

import org.arcx.model.PolymorphicMapping;
import org.arcx.runtime.validation.ExclusivityValidator;
import org.arcx.runtime.validation.ValidationResult;

import java.util.function.Function;

/**
 * One exclusive arc registered for an entity type.
 */
public final class ExclusiveArcBinding<E> {
    private final Class<E> entityType;
    private final PolymorphicMapping mapping;
    private final Function<? super E, AttributeReader> readerFactory;
    private final EntityStore store;
    private final ActiveKeyResolver resolver;
    private final ExclusivityValidator validator;

    ExclusiveArcBinding(Class<E> entityType, PolymorphicMapping mapping,
                        Function<? super E, AttributeReader> readerFactory, EntityStore store) {
        this.entityType = entityType;
        this.mapping = mapping;
        this.readerFactory = readerFactory;
        this.store = store;
        this.resolver = new ActiveKeyResolver(mapping);
        this.validator = new ExclusivityValidator(mapping, resolver);
    }

    /**
     * @throws ClassCastException when {@code entity} is not an instance of the registered type
     */
    public ExclusiveAssociation bind(Object entity) {
        return new ExclusiveAssociation(mapping, resolver, readerOf(entity), store);
    }

    public ValidationResult validate(Object entity) {
        return validator.validate(readerOf(entity));
    }

    private AttributeReader readerOf(Object entity) {
        return readerFactory.apply(entityType.cast(entity));
    }

    public Class<E> getEntityType() {
        return entityType;
    }

    public PolymorphicMapping getMapping() {
        return mapping;
    }

    public ExclusivityValidator getValidator() {
        return validator;
    }
}
