package org.arcx.migration;

import org.arcx.migration.dialect.h2.H2Dialect;
import org.arcx.migration.dialect.mysql.MySqlDialect;
import org.arcx.migration.dialect.postgresql.PostgreSqlDialect;
import org.arcx.migration.spi.dialect.DdlDialect;

import java.util.Locale;

public enum DatabaseType {
    MYSQL,
    POSTGRESQL,
    H2;

    public DdlDialect newDialect() {
        return switch (this) {
            case MYSQL -> new MySqlDialect();
            case POSTGRESQL -> new PostgreSqlDialect();
            case H2 -> new H2Dialect();
        };
    }

    /**
     * Resolves a CLI/config dialect name ({@code mysql}, {@code postgres}, {@code h2} ...).
     */
    public static DatabaseType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Dialect name must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "mysql", "mariadb" -> MYSQL;
            case "postgresql", "postgres", "pg" -> POSTGRESQL;
            case "h2" -> H2;
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }
}
