package org.arcx.migration.spi.dialect;

import org.arcx.migration.DatabaseType;

public interface BaseDialect {
    DatabaseType getDatabaseType();
    String quoteIdentifier(String raw);
    String quoteLiteral(String raw);
    int getMaxIdentifierLength();
}
