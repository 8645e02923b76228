package org.arcx.runtime;

import org.arcx.model.ActiveKeyState;
import org.arcx.model.PolymorphicMapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the {@link ActiveKeyState} of an entity from its current attribute values.
 *
 * <p>Total: every input maps to a state. Only declared columns are inspected, in declaration
 * order; absent columns count as null and undeclared keys are ignored. Nothing is cached.
 */
public class ActiveKeyResolver {
    private final List<String> columns;

    public ActiveKeyResolver(PolymorphicMapping mapping) {
        this.columns = mapping.columns();
    }

    public ActiveKeyState resolve(Map<String, ?> columnValues) {
        return resolve(AttributeReader.of(columnValues));
    }

    public ActiveKeyState resolve(AttributeReader reader) {
        List<String> set = new ArrayList<>(2);
        for (String column : columns) {
            if (reader.currentValue(column) != null) {
                set.add(column);
            }
        }
        return switch (set.size()) {
            case 0 -> ActiveKeyState.UNSET;
            case 1 -> new ActiveKeyState.Resolved(set.get(0));
            default -> new ActiveKeyState.Conflict(set);
        };
    }

    public List<String> getColumns() {
        return columns;
    }
}
