package org.arcx.runtime;

import java.util.Optional;

/**
 * Host capability to load a referenced entity by its key value.
 */
@FunctionalInterface
public interface EntityStore {
    Optional<Object> fetchById(String referencedTable, Object id);
}
