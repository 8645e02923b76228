package org.arcx.migration.trigger;

import org.arcx.model.PolymorphicMapping;
import org.arcx.naming.Naming;

import java.util.List;

/**
 * Builds the {@link ExclusivityCheck} of a mapping. Depends only on the owner table and the
 * relation column list, never on the referenced tables.
 */
public class ExclusivityTriggerGenerator {
    private final Naming naming;

    public ExclusivityTriggerGenerator(Naming naming) {
        this.naming = naming;
    }

    public ExclusivityCheck generate(PolymorphicMapping mapping) {
        List<String> columns = mapping.columns();
        boolean unique = mapping.getOptions().isUniqueAcrossColumns();
        return ExclusivityCheck.builder()
                .ownerTable(mapping.getOwnerTable())
                .ownerPrimaryKey(mapping.getOwnerPrimaryKey())
                .triggerName(naming.triggerName(mapping.getOwnerTable(), mapping.getRole()))
                .columns(columns)
                .message(violationMessage(mapping.getOwnerTable(), columns))
                .uniqueAcrossColumns(unique)
                .uniqueMessage(unique ? uniquenessMessage(mapping.getOwnerTable(), columns) : null)
                .build();
    }

    static String violationMessage(String table, List<String> columns) {
        return table + ": exactly one of (" + String.join(", ", columns) + ") must be set";
    }

    static String uniquenessMessage(String table, List<String> columns) {
        return table + ": active value of (" + String.join(", ", columns) + ") is already referenced";
    }
}
