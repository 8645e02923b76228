package org.arcx.migration;

import org.arcx.exception.UnsupportedMappingException;
import org.arcx.migration.contributor.create.ExclusivityTriggerAddContributor;
import org.arcx.migration.contributor.create.ForeignKeyAddContributor;
import org.arcx.migration.contributor.create.IndexAddContributor;
import org.arcx.migration.contributor.drop.ExclusivityTriggerDropContributor;
import org.arcx.migration.contributor.drop.ForeignKeyDropContributor;
import org.arcx.migration.contributor.drop.IndexDropContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.migration.trigger.ExclusivityTriggerGenerator;
import org.arcx.model.CompiledConstraintSet;
import org.arcx.model.DdlStatement;
import org.arcx.model.ForeignKeyModel;
import org.arcx.model.IndexModel;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.ReferencedKeyCatalog;
import org.arcx.model.Relation;
import org.arcx.naming.Naming;

import java.util.List;

/**
 * Compiles a {@link PolymorphicMapping} into the foreign keys, indexes and exclusivity trigger
 * that enforce it, and into the statements that remove exactly those objects.
 *
 * <p>Add and remove lists are computed independently from the mapping with the same naming
 * rules, so removal never needs a record of what was added. Both fail as a whole: no partial
 * list is returned.
 */
public class ExclusiveArcCompiler {
    private final DdlDialect dialect;
    private final Naming naming;
    private final ReferencedKeyCatalog catalog;
    private final ExclusivityTriggerGenerator triggerGenerator;

    public ExclusiveArcCompiler(DdlDialect dialect, Naming naming) {
        this(dialect, naming, ReferencedKeyCatalog.UNDECLARED);
    }

    public ExclusiveArcCompiler(DdlDialect dialect, Naming naming, ReferencedKeyCatalog catalog) {
        this.dialect = dialect;
        this.naming = naming;
        this.catalog = catalog;
        this.triggerGenerator = new ExclusivityTriggerGenerator(naming);
    }

    /**
     * Per relation in declared order: foreign key, then index. Then one exclusivity trigger.
     */
    public List<DdlStatement> compileAdd(PolymorphicMapping mapping) {
        checkSupported(mapping);
        ConstraintSetBuilder builder = new ConstraintSetBuilder(dialect);
        for (Relation rel : mapping.getRelations()) {
            builder.add(new ForeignKeyAddContributor(foreignKeyOf(mapping, rel)));
            if (rel.isIndexed()) {
                builder.add(new IndexAddContributor(indexOf(mapping, rel)));
            }
        }
        builder.add(new ExclusivityTriggerAddContributor(triggerGenerator.generate(mapping), naming));
        return builder.build();
    }

    /**
     * Trigger objects, then foreign keys, then indexes.
     */
    public List<DdlStatement> compileRemove(PolymorphicMapping mapping) {
        checkSupported(mapping);
        ConstraintSetBuilder builder = new ConstraintSetBuilder(dialect);
        builder.add(new ExclusivityTriggerDropContributor(triggerGenerator.generate(mapping), naming));
        for (Relation rel : mapping.getRelations()) {
            builder.add(new ForeignKeyDropContributor(foreignKeyOf(mapping, rel)));
            if (rel.isIndexed()) {
                builder.add(new IndexDropContributor(indexOf(mapping, rel)));
            }
        }
        return builder.build();
    }

    public CompiledConstraintSet compile(PolymorphicMapping mapping) {
        return new CompiledConstraintSet(mapping, compileAdd(mapping), compileRemove(mapping));
    }

    public ExclusivityCheck exclusivityCheck(PolymorphicMapping mapping) {
        return triggerGenerator.generate(mapping);
    }

    public ForeignKeyModel foreignKeyOf(PolymorphicMapping mapping, Relation rel) {
        String prefix = mapping.getOptions().getForeignKeyNamePrefix();
        String name = prefix != null && !prefix.isBlank()
                ? naming.prefixed(prefix, rel.getColumn())
                : naming.fkName(mapping.getOwnerTable(), rel.getColumn(), rel.getReferencedTable());
        return ForeignKeyModel.builder()
                .name(name)
                .tableName(mapping.getOwnerTable())
                .column(rel.getColumn())
                .referencedTable(rel.getReferencedTable())
                .referencedColumn(rel.getReferencedColumn())
                .onDelete(rel.getOnDelete())
                .build();
    }

    public IndexModel indexOf(PolymorphicMapping mapping, Relation rel) {
        String prefix = mapping.getOptions().getIndexNamePrefix();
        String name = prefix != null && !prefix.isBlank()
                ? naming.prefixed(prefix, rel.getColumn())
                : naming.ixName(mapping.getOwnerTable(), rel.getColumn());
        return IndexModel.builder()
                .indexName(name)
                .tableName(mapping.getOwnerTable())
                .column(rel.getColumn())
                .build();
    }

    public DdlDialect getDialect() {
        return dialect;
    }

    private void checkSupported(PolymorphicMapping mapping) {
        for (Relation rel : mapping.getRelations()) {
            if (catalog.isDeclared(rel.getReferencedTable())
                    && !catalog.isKey(rel.getReferencedTable(), rel.getReferencedColumn())) {
                throw new UnsupportedMappingException(dialect.getDatabaseType(),
                        mapping.getOwnerTable() + "." + rel.getColumn() + " references "
                                + rel.getReferencedTable() + "." + rel.getReferencedColumn()
                                + ", which is not a primary or unique key (declared keys: "
                                + catalog.keysOf(rel.getReferencedTable()) + ")");
            }
        }
        dialect.checkSupported(mapping);
    }
}
