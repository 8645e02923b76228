package org.arcx.config.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.arcx.exception.InvalidMappingException;
import org.arcx.model.MappingOptions;
import org.arcx.model.OnDeleteAction;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.ReferencedKeyCatalog;
import org.arcx.model.Relation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads exclusive-arc declarations from YAML.
 *
 * <pre>
 * referencedKeys:
 *   employees: [id]
 * mappings:
 *   - table: comments
 *     role: owner
 *     relations:
 *       - column: employee_id
 *         references: employees.id
 *       - column: product_id
 *         referencedTable: products
 * </pre>
 */
public class MappingLoader {

    private final ObjectMapper yamlMapper;

    public MappingLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public LoadedMappings load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidMappingException("Mapping file not found: " + file);
        }
        try {
            return toMappings(yamlMapper.readValue(file.toFile(), MappingFile.class), file.toString());
        } catch (IOException e) {
            throw new InvalidMappingException("Failed to parse " + file + ": " + e.getMessage(), e);
        }
    }

    public LoadedMappings read(String yaml) {
        try {
            return toMappings(yamlMapper.readValue(yaml, MappingFile.class), "<inline>");
        } catch (IOException e) {
            throw new InvalidMappingException("Failed to parse mapping declaration: " + e.getMessage(), e);
        }
    }

    private LoadedMappings toMappings(MappingFile file, String source) {
        // 빈 문서는 null 로 역직렬화된다
        if (file == null || file.getMappings() == null || file.getMappings().isEmpty()) {
            throw new InvalidMappingException("No mappings declared in " + source);
        }

        ReferencedKeyCatalog.Builder catalog = ReferencedKeyCatalog.builder();
        if (file.getReferencedKeys() != null) {
            file.getReferencedKeys().forEach((table, keys) -> catalog.table(table, keys == null ? List.of() : keys));
        }

        List<PolymorphicMapping> mappings = new ArrayList<>();
        for (MappingFile.MappingDefinition def : file.getMappings()) {
            mappings.add(toMapping(def));
        }
        return new LoadedMappings(mappings, catalog.build());
    }

    private PolymorphicMapping toMapping(MappingFile.MappingDefinition def) {
        PolymorphicMapping.PolymorphicMappingBuilder builder = PolymorphicMapping.builder()
                .ownerTable(def.getTable())
                .ownerPrimaryKey(def.getPrimaryKey())
                .role(def.getRole());
        if (def.getRelations() != null) {
            for (MappingFile.RelationDefinition rel : def.getRelations()) {
                builder.relation(toRelation(def.getTable(), rel));
            }
        }
        if (def.getOptions() != null) {
            builder.options(MappingOptions.builder()
                    .uniqueAcrossColumns(def.getOptions().isUniqueAcrossColumns())
                    .indexNamePrefix(def.getOptions().getIndexNamePrefix())
                    .foreignKeyNamePrefix(def.getOptions().getForeignKeyNamePrefix())
                    .build());
        }
        return builder.build();
    }

    private Relation toRelation(String table, MappingFile.RelationDefinition def) {
        if (def == null) {
            throw new InvalidMappingException("Empty relation entry in mapping of " + table);
        }
        String referencedTable = def.getReferencedTable();
        String referencedColumn = def.getReferencedColumn();
        if (def.getReferences() != null) {
            if (referencedTable != null || referencedColumn != null) {
                throw new InvalidMappingException(table + "." + def.getColumn()
                        + ": 'references' cannot be combined with referencedTable/referencedColumn");
            }
            String ref = def.getReferences().trim();
            int dot = ref.lastIndexOf('.');
            if (dot < 0) {
                referencedTable = ref;
            } else {
                referencedTable = ref.substring(0, dot);
                referencedColumn = ref.substring(dot + 1);
            }
        }

        Relation.RelationBuilder builder = Relation.builder()
                .column(def.getColumn())
                .referencedTable(referencedTable)
                .name(def.getName());
        if (referencedColumn != null) {
            builder.referencedColumn(referencedColumn);
        }
        if (def.getOnDelete() != null) {
            builder.onDelete(parseOnDelete(table, def));
        }
        if (def.getIndexed() != null) {
            builder.indexed(def.getIndexed());
        }
        return builder.build();
    }

    private OnDeleteAction parseOnDelete(String table, MappingFile.RelationDefinition def) {
        String normalized = def.getOnDelete().trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        try {
            return OnDeleteAction.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidMappingException(table + "." + def.getColumn()
                    + ": unknown onDelete action '" + def.getOnDelete() + "'", e);
        }
    }
}
