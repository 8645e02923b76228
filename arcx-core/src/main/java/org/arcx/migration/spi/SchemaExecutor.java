package org.arcx.migration.spi;

import org.arcx.model.DdlStatement;

import java.sql.SQLException;
import java.util.List;

/**
 * Host-side collaborator that applies compiled statements, inside a transaction it owns.
 * arcx itself never executes SQL.
 */
@FunctionalInterface
public interface SchemaExecutor {
    void execute(DdlStatement statement) throws SQLException;

    default void executeAll(List<DdlStatement> statements) throws SQLException {
        for (DdlStatement statement : statements) {
            execute(statement);
        }
    }
}
