package org.arcx.model;

import java.util.List;

/**
 * Which relation of an exclusive arc is currently set. Always derived from the current
 * attribute values, never stored.
 */
public sealed interface ActiveKeyState
        permits ActiveKeyState.Unset, ActiveKeyState.Resolved, ActiveKeyState.Conflict {

    Unset UNSET = new Unset();

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    /** None of the declared columns is set. */
    record Unset() implements ActiveKeyState {
    }

    /** Exactly one declared column is set. */
    record Resolved(String column) implements ActiveKeyState {
    }

    /** Two or more declared columns are set, in declaration order. */
    record Conflict(List<String> setColumns) implements ActiveKeyState {
        public Conflict {
            setColumns = List.copyOf(setColumns);
        }
    }
}
