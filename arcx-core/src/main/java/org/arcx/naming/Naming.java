package org.arcx.naming;

/**
 * Deterministic naming of the schema objects an exclusive arc creates.
 *
 * <p>Names must be a pure function of their inputs: the remove compiler recomputes them instead
 * of looking up what the add compiler produced.
 */
public interface Naming {
    String fkName(String table, String column, String referencedTable);
    String ixName(String table, String column);
    String triggerName(String table, String role);

    /**
     * Name built from a user-supplied prefix, e.g. {@code fk_assign_} + {@code employee_id}.
     */
    String prefixed(String prefix, String column);

    /**
     * Derived name for a companion object, e.g. {@code trg_x} + {@code _bi}.
     * The suffix is always kept whole.
     */
    String withSuffix(String name, String suffix);

    int maxLength();
}
