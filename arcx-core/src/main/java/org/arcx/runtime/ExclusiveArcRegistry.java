package org.arcx.runtime;

import org.arcx.model.PolymorphicMapping;
import org.arcx.runtime.validation.ExclusivityValidator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Explicit registration of exclusive arcs per entity type, done once during host start-up.
 * An entity type may carry several arcs as long as their roles differ.
 */
public class ExclusiveArcRegistry {
    private final EntityStore store;
    private final Map<Class<?>, Map<String, ExclusiveArcBinding<?>>> bindings = new ConcurrentHashMap<>();

    public ExclusiveArcRegistry(EntityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public <E> ExclusiveArcBinding<E> register(Class<E> entityType, PolymorphicMapping mapping,
                                               Function<? super E, AttributeReader> readerFactory) {
        ExclusiveArcBinding<E> binding = new ExclusiveArcBinding<>(entityType, mapping, readerFactory, store);
        Map<String, ExclusiveArcBinding<?>> byRole = bindings.computeIfAbsent(entityType, k -> new ConcurrentHashMap<>());
        if (byRole.putIfAbsent(mapping.getRole(), binding) != null) {
            throw new IllegalStateException("Role '" + mapping.getRole() + "' is already registered for "
                    + entityType.getName());
        }
        return binding;
    }

    public boolean isRegistered(Class<?> entityType) {
        return bindings.containsKey(entityType);
    }

    /**
     * @throws IllegalArgumentException when the type has no arc, or more than one
     */
    public ExclusiveArcBinding<?> binding(Class<?> entityType) {
        Map<String, ExclusiveArcBinding<?>> byRole = rolesOf(entityType);
        if (byRole.size() != 1) {
            throw new IllegalArgumentException(entityType.getName() + " has " + byRole.size()
                    + " exclusive arcs " + byRole.keySet() + ", pass the role");
        }
        return byRole.values().iterator().next();
    }

    public ExclusiveArcBinding<?> binding(Class<?> entityType, String role) {
        ExclusiveArcBinding<?> binding = rolesOf(entityType).get(role);
        if (binding == null) {
            throw new IllegalArgumentException("No exclusive arc '" + role + "' registered for " + entityType.getName());
        }
        return binding;
    }

    public List<ExclusiveArcBinding<?>> bindingsOf(Class<?> entityType) {
        return List.copyOf(rolesOf(entityType).values());
    }

    public ExclusiveAssociation bind(Object entity) {
        return binding(entity.getClass()).bind(entity);
    }

    public ExclusiveAssociation bind(Object entity, String role) {
        return binding(entity.getClass(), role).bind(entity);
    }

    public ExclusivityValidator validator(Class<?> entityType) {
        return binding(entityType).getValidator();
    }

    private Map<String, ExclusiveArcBinding<?>> rolesOf(Class<?> entityType) {
        Map<String, ExclusiveArcBinding<?>> byRole = bindings.get(entityType);
        if (byRole == null || byRole.isEmpty()) {
            throw new IllegalArgumentException("No exclusive arc registered for " + entityType.getName());
        }
        return byRole;
    }
}
