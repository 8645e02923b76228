package org.arcx.model;

public enum OnDeleteAction {
    NO_ACTION,
    RESTRICT,
    CASCADE,
    SET_NULL,
    SET_DEFAULT;

    /**
     * SQL keyword form, e.g. {@code SET NULL}.
     */
    public String sql() {
        return name().replace('_', ' ');
    }
}
