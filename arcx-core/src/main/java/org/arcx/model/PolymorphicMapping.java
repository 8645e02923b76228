package org.arcx.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.arcx.exception.InvalidMappingException;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Declaration of an exclusive arc: an owner table carrying one nullable foreign-key column per
 * possible target, of which exactly one must be set.
 *
 * <p>Instances are immutable and validated on construction; nothing else in arcx validates the
 * shape of a mapping.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PolymorphicMapping {
    public static final String DEFAULT_PRIMARY_KEY = "id";
    public static final String DEFAULT_ROLE = "association";

    private final String ownerTable;
    private final String ownerPrimaryKey;
    private final String role;
    private final List<Relation> relations;
    private final MappingOptions options;

    @Builder
    private PolymorphicMapping(String ownerTable,
                               String ownerPrimaryKey,
                               String role,
                               @Singular List<Relation> relations,
                               MappingOptions options) {
        this.ownerTable = ownerTable;
        this.ownerPrimaryKey = ownerPrimaryKey != null ? ownerPrimaryKey : DEFAULT_PRIMARY_KEY;
        this.role = role != null ? role : DEFAULT_ROLE;
        this.relations = relations == null ? List.of() : List.copyOf(relations);
        this.options = options != null ? options : MappingOptions.DEFAULTS;
        validate();
    }

    /**
     * Declared foreign-key columns in declaration order.
     */
    public List<String> columns() {
        return relations.stream().map(Relation::getColumn).toList();
    }

    public Optional<Relation> relation(String column) {
        return relations.stream()
                .filter(r -> r.getColumn().equalsIgnoreCase(column))
                .findFirst();
    }

    private void validate() {
        requireIdentifier(ownerTable, "owner table");
        requireIdentifier(ownerPrimaryKey, "owner primary key of " + ownerTable);
        requireIdentifier(role, "role of " + ownerTable);

        if (relations.size() < 2) {
            if (options.isUniqueAcrossColumns()) {
                throw new InvalidMappingException("uniqueAcrossColumns on " + ownerTable
                        + " needs at least 2 relations, got " + relations.size());
            }
            throw new InvalidMappingException("Exclusive arc on " + ownerTable
                    + " needs at least 2 relations, got " + relations.size());
        }

        Set<String> seen = new HashSet<>();
        for (Relation rel : relations) {
            if (rel == null) {
                throw new InvalidMappingException("Null relation in mapping of " + ownerTable);
            }
            requireIdentifier(rel.getColumn(), "relation column of " + ownerTable);
            requireIdentifier(rel.getReferencedTable(), "referenced table of " + ownerTable + "." + rel.getColumn());
            requireIdentifier(rel.getReferencedColumn(), "referenced column of " + ownerTable + "." + rel.getColumn());

            String key = rel.getColumn().toLowerCase(Locale.ROOT);
            if (!seen.add(key)) {
                throw new InvalidMappingException("Duplicate relation column '" + rel.getColumn()
                        + "' in mapping of " + ownerTable);
            }
            if (rel.getColumn().equalsIgnoreCase(ownerPrimaryKey)) {
                throw new InvalidMappingException("Relation column '" + rel.getColumn()
                        + "' is the primary key of " + ownerTable);
            }
        }
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new InvalidMappingException("Missing " + what);
        }
    }
}
