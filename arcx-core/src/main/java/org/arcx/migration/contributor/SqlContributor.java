package org.arcx.migration.contributor;

public interface SqlContributor {
    /**
     * Lower runs first. Contributors with equal priority keep their insertion order.
     */
    int priority();
}
