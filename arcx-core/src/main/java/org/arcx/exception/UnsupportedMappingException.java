package org.arcx.exception;

import org.arcx.migration.DatabaseType;

/**
 * The compiler cannot express a mapping as constraints of the target database.
 */
public class UnsupportedMappingException extends ArcxException {
    private final DatabaseType databaseType;

    public UnsupportedMappingException(DatabaseType databaseType, String message) {
        super("[" + databaseType + "] " + message);
        this.databaseType = databaseType;
    }

    public DatabaseType getDatabaseType() {
        return databaseType;
    }
}
