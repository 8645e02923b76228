package org.arcx.exception;

import lombok.Getter;

/**
 * The active foreign key points at a row the entity store cannot find.
 * Under an enforced foreign key this means the constraint was bypassed.
 */
@Getter
public class DanglingReferenceException extends ArcxException {
    private final String referencedTable;
    private final String column;
    private final Object id;

    public DanglingReferenceException(String referencedTable, String column, Object id) {
        super("Dangling reference: " + column + "=" + id + " has no row in " + referencedTable);
        this.referencedTable = referencedTable;
        this.column = column;
        this.id = id;
    }
}
