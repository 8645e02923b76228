package org.arcx.model;

import java.util.List;

/**
 * Add statements and their structural inverse for one mapping.
 */
public record CompiledConstraintSet(PolymorphicMapping mapping,
                                    List<DdlStatement> addStatements,
                                    List<DdlStatement> removeStatements) {
    public CompiledConstraintSet {
        addStatements = List.copyOf(addStatements);
        removeStatements = List.copyOf(removeStatements);
    }
}
