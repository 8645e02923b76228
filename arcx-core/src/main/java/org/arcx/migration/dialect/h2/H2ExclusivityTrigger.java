package org.arcx.migration.dialect.h2;

import org.h2.api.Trigger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Row trigger behind {@link H2Dialect}: rejects a row image unless exactly one of the configured
 * columns is non-null, and optionally rejects an active value already held by another row.
 */
public class H2ExclusivityTrigger implements Trigger {
    public static final String CHECK_VIOLATION = "23514";
    public static final String UNIQUE_VIOLATION = "23505";

    private final String message;
    private final String uniqueMessage;
    private final String primaryKey;
    private final String[] columns;

    private String schemaName;
    private String tableName;
    private int[] columnIndexes;
    private String[] storedNames;
    private int primaryKeyIndex = -1;
    private String storedPrimaryKey;

    public H2ExclusivityTrigger(String message, String uniqueMessage, String primaryKey, String[] columns) {
        this.message = message;
        this.uniqueMessage = uniqueMessage;
        this.primaryKey = primaryKey;
        this.columns = columns.clone();
    }

    @Override
    public void init(Connection conn, String schemaName, String triggerName, String tableName,
                     boolean before, int type) throws SQLException {
        this.schemaName = schemaName;
        this.tableName = tableName;

        Map<String, Integer> positions = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COLUMN_NAME, ORDINAL_POSITION FROM INFORMATION_SCHEMA.COLUMNS"
                        + " WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?")) {
            ps.setString(1, schemaName);
            ps.setString(2, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1).toLowerCase(Locale.ROOT);
                    positions.put(key, rs.getInt(2) - 1);
                    names.put(key, rs.getString(1));
                }
            }
        }

        columnIndexes = new int[columns.length];
        storedNames = new String[columns.length];
        for (int i = 0; i < columns.length; i++) {
            Integer pos = positions.get(columns[i].toLowerCase(Locale.ROOT));
            if (pos == null) {
                throw new SQLException("Trigger " + triggerName + ": column " + columns[i]
                        + " not found in " + schemaName + "." + tableName, "42S22");
            }
            columnIndexes[i] = pos;
            storedNames[i] = names.get(columns[i].toLowerCase(Locale.ROOT));
        }
        if (uniqueMessage != null) {
            Integer pk = positions.get(primaryKey.toLowerCase(Locale.ROOT));
            if (pk == null) {
                throw new SQLException("Trigger " + triggerName + ": primary key " + primaryKey
                        + " not found in " + schemaName + "." + tableName, "42S22");
            }
            primaryKeyIndex = pk;
            storedPrimaryKey = names.get(primaryKey.toLowerCase(Locale.ROOT));
        }
    }

    @Override
    public void fire(Connection conn, Object[] oldRow, Object[] newRow) throws SQLException {
        if (newRow == null) {
            return; // delete
        }
        int active = -1;
        int count = 0;
        for (int i = 0; i < columnIndexes.length; i++) {
            if (newRow[columnIndexes[i]] != null) {
                count++;
                active = i;
            }
        }
        if (count != 1) {
            throw new SQLException(message, CHECK_VIOLATION);
        }
        if (uniqueMessage != null && isHeldByAnotherRow(conn, active, newRow)) {
            throw new SQLException(uniqueMessage, UNIQUE_VIOLATION);
        }
    }

    private boolean isHeldByAnotherRow(Connection conn, int active, Object[] newRow) throws SQLException {
        Object value = newRow[columnIndexes[active]];
        Object id = newRow[primaryKeyIndex];
        String sql = "SELECT COUNT(*) FROM " + quote(schemaName) + "." + quote(tableName)
                + " WHERE " + quote(storedNames[active]) + " = ?"
                + (id != null ? " AND " + quote(storedPrimaryKey) + " <> ?" : "");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, value);
            if (id != null) {
                ps.setObject(2, id);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public void close() {
    }

    @Override
    public void remove() {
    }

    @Override
    public String toString() {
        return "H2ExclusivityTrigger" + Arrays.toString(columns);
    }
}
