package org.arcx.model;

/**
 * One executable schema statement, without a trailing delimiter.
 *
 * @param kind       kind of schema object the statement creates or drops
 * @param objectName name of that object
 * @param sql        statement text
 */
public record DdlStatement(DdlObjectKind kind, String objectName, String sql) {

    @Override
    public String toString() {
        return sql;
    }
}
