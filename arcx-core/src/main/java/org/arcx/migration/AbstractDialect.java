package org.arcx.migration;

import org.arcx.exception.UnsupportedMappingException;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlStatement;
import org.arcx.model.ForeignKeyModel;
import org.arcx.model.IndexModel;
import org.arcx.model.OnDeleteAction;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.Relation;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public abstract class AbstractDialect implements DdlDialect {

    /**
     * Quotes a single identifier part.
     */
    protected abstract String quotePart(String part);

    /**
     * Reason the engine cannot honour {@code action}, or {@code null} when it can.
     */
    protected String unsupportedOnDelete(OnDeleteAction action) {
        return switch (action) {
            // 활성 키를 바꾸는 cascade 갱신은 배타성 검사에 걸려 부모 삭제가 항상 실패한다
            case SET_NULL, SET_DEFAULT -> "the cascaded update rewrites the active key and the exclusivity check rejects it";
            default -> null;
        };
    }

    /**
     * Quotes an identifier, treating dots as schema qualifiers ({@code hr.employees}).
     */
    @Override
    public String quoteIdentifier(String raw) {
        return Arrays.stream(raw.split("\\."))
                .map(this::quotePart)
                .collect(Collectors.joining("."));
    }

    @Override
    public String quoteLiteral(String raw) {
        return "'" + raw.replace("'", "''") + "'";
    }

    @Override
    public String getAddForeignKeySql(ForeignKeyModel fk) {
        StringBuilder sb = new StringBuilder();
        sb.append("ALTER TABLE ").append(quoteIdentifier(fk.getTableName()))
                .append(" ADD CONSTRAINT ").append(quoteIdentifier(fk.getName()))
                .append(" FOREIGN KEY (").append(quoteIdentifier(fk.getColumn())).append(")")
                .append(" REFERENCES ").append(quoteIdentifier(fk.getReferencedTable()))
                .append(" (").append(quoteIdentifier(fk.getReferencedColumn())).append(")");
        if (fk.getOnDelete() != null && fk.getOnDelete() != OnDeleteAction.NO_ACTION) {
            sb.append(" ON DELETE ").append(fk.getOnDelete().sql());
        }
        return sb.toString();
    }

    @Override
    public String getDropForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.getTableName())
                + " DROP CONSTRAINT " + quoteIdentifier(fk.getName());
    }

    @Override
    public String indexStatement(IndexModel idx) {
        return "CREATE INDEX " + quoteIdentifier(idx.getIndexName())
                + " ON " + quoteIdentifier(idx.getTableName())
                + " (" + quoteIdentifier(idx.getColumn()) + ")";
    }

    @Override
    public void checkSupported(PolymorphicMapping mapping) {
        for (Relation rel : mapping.getRelations()) {
            String reason = unsupportedOnDelete(rel.getOnDelete());
            if (reason != null) {
                throw new UnsupportedMappingException(getDatabaseType(),
                        mapping.getOwnerTable() + "." + rel.getColumn() + " ON DELETE "
                                + rel.getOnDelete().sql() + ": " + reason);
            }
        }
    }

    /**
     * Puts {@code name} in the owner table's schema: ({@code hr.comments}, {@code trg}) -> {@code hr.trg}.
     */
    protected String inOwnerSchema(String ownerTable, String name) {
        int dot = ownerTable.lastIndexOf('.');
        return dot >= 0 ? ownerTable.substring(0, dot) + "." + name : name;
    }

    @Override
    public String renderScript(List<DdlStatement> statements) {
        return statements.stream()
                .map(s -> s.sql() + ";")
                .collect(Collectors.joining("\n\n", "", statements.isEmpty() ? "" : "\n"));
    }

    /**
     * {@code NEW."a", NEW."b"} style list of the checked columns.
     */
    protected List<String> newRowRefs(List<String> columns) {
        return columns.stream().map(c -> "NEW." + quoteIdentifier(c)).toList();
    }

    /**
     * Predicate matching another row that already holds the active value:
     * {@code ("a" = NEW."a" OR "b" = NEW."b")}. Only the non-null column can match.
     */
    protected String sameActiveValuePredicate(List<String> columns) {
        return columns.stream()
                .map(c -> quoteIdentifier(c) + " = NEW." + quoteIdentifier(c))
                .collect(Collectors.joining(" OR ", "(", ")"));
    }
}
