package org.arcx.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicitly declared primary/unique key columns of referenced tables.
 *
 * <p>arcx never introspects a live schema. Tables absent from the catalog are trusted as declared
 * by the mapping; tables present in it must expose the referenced column as a key.
 */
public final class ReferencedKeyCatalog {
    public static final ReferencedKeyCatalog UNDECLARED = new ReferencedKeyCatalog(Map.of());

    private final Map<String, Set<String>> keysByTable;

    private ReferencedKeyCatalog(Map<String, Set<String>> keysByTable) {
        this.keysByTable = keysByTable;
    }

    public boolean isDeclared(String table) {
        return keysByTable.containsKey(norm(table));
    }

    public boolean isKey(String table, String column) {
        Set<String> keys = keysByTable.get(norm(table));
        return keys != null && keys.contains(norm(column));
    }

    public Set<String> keysOf(String table) {
        return keysByTable.getOrDefault(norm(table), Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String norm(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Set<String>> keys = new HashMap<>();

        public Builder table(String table, String... keyColumns) {
            return table(table, Arrays.asList(keyColumns));
        }

        public Builder table(String table, Collection<String> keyColumns) {
            keys.computeIfAbsent(norm(table), k -> new LinkedHashSet<>())
                    .addAll(keyColumns.stream().map(ReferencedKeyCatalog::norm).collect(Collectors.toList()));
            return this;
        }

        public ReferencedKeyCatalog build() {
            Map<String, Set<String>> copy = new HashMap<>();
            keys.forEach((t, cols) -> copy.put(t, Collections.unmodifiableSet(new LinkedHashSet<>(cols))));
            return new ReferencedKeyCatalog(Collections.unmodifiableMap(copy));
        }
    }
}
