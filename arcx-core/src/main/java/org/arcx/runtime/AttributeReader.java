package org.arcx.runtime;

import java.util.Map;

/**
 * Reads the current, possibly unsaved, attribute values of one entity instance.
 */
@FunctionalInterface
public interface AttributeReader {
    Object currentValue(String column);

    static AttributeReader of(Map<String, ?> values) {
        if (values == null) {
            return column -> null;
        }
        return values::get;
    }
}
