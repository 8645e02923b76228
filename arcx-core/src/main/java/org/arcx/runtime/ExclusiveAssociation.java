package org.arcx.runtime;

import org.arcx.exception.DanglingReferenceException;
import org.arcx.model.ActiveKeyState;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.Relation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one entity instance's exclusive arc.
 *
 * <p>Every call re-reads the current attribute values, so setters on the host entity are seen
 * immediately. Unset and conflicting states are ordinary results here, never errors.
 */
public class ExclusiveAssociation {
    private final PolymorphicMapping mapping;
    private final ActiveKeyResolver resolver;
    private final AttributeReader reader;
    private final EntityStore store;

    public ExclusiveAssociation(PolymorphicMapping mapping, AttributeReader reader, EntityStore store) {
        this(mapping, new ActiveKeyResolver(mapping), reader, store);
    }

    ExclusiveAssociation(PolymorphicMapping mapping, ActiveKeyResolver resolver,
                         AttributeReader reader, EntityStore store) {
        this.mapping = mapping;
        this.resolver = resolver;
        this.reader = reader;
        this.store = store;
    }

    public ActiveKeyState state() {
        return resolver.resolve(reader);
    }

    /**
     * @return the active column, or {@code null} when unset or conflicting
     */
    public String activeKey() {
        return state() instanceof ActiveKeyState.Resolved resolved ? resolved.column() : null;
    }

    public boolean hasActiveAssociation() {
        return state().isResolved();
    }

    public Optional<Relation> activeRelation() {
        return Optional.ofNullable(activeKey()).flatMap(mapping::relation);
    }

    /**
     * Loads the referenced entity of the active relation.
     *
     * @return the entity, or {@code null} when unset or conflicting
     * @throws DanglingReferenceException when the active value has no row in the referenced table
     */
    public Object activeAssociation() {
        Map<String, Object> snapshot = snapshot();
        if (!(resolver.resolve(snapshot) instanceof ActiveKeyState.Resolved resolved)) {
            return null;
        }
        Relation rel = mapping.relation(resolved.column()).orElseThrow();
        Object id = snapshot.get(resolved.column());
        return store.fetchById(rel.getReferencedTable(), id)
                .orElseThrow(() -> new DanglingReferenceException(rel.getReferencedTable(), rel.getColumn(), id));
    }

    /**
     * Single-entry {@code {activeColumn: value}} filter, or an empty map when unset or conflicting.
     */
    public Map<String, Object> activeQueryCondition() {
        Map<String, Object> snapshot = snapshot();
        if (resolver.resolve(snapshot) instanceof ActiveKeyState.Resolved resolved) {
            return Map.of(resolved.column(), snapshot.get(resolved.column()));
        }
        return Map.of();
    }

    public List<String> declaredKeys() {
        return mapping.columns();
    }

    /**
     * Relation short names in declaration order, followed by the role name.
     */
    public List<String> declaredRelationNames() {
        List<String> names = new ArrayList<>();
        for (Relation rel : mapping.getRelations()) {
            names.add(rel.shortName());
        }
        names.add(mapping.getRole());
        return List.copyOf(names);
    }

    public PolymorphicMapping getMapping() {
        return mapping;
    }

    private Map<String, Object> snapshot() {
        Map<String, Object> values = new HashMap<>();
        for (String column : resolver.getColumns()) {
            Object value = reader.currentValue(column);
            if (value != null) {
                values.put(column, value);
            }
        }
        return values;
    }
}
