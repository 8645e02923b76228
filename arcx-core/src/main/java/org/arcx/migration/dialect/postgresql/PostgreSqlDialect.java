package org.arcx.migration.dialect.postgresql;

import org.arcx.migration.AbstractDialect;
import org.arcx.migration.DatabaseType;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.IndexModel;
import org.arcx.naming.Naming;

import java.util.List;

/**
 * PostgreSQL 11+: one plpgsql trigger function and one {@code BEFORE INSERT OR UPDATE} trigger.
 */
public class PostgreSqlDialect extends AbstractDialect {

    static final String FUNCTION_SUFFIX = "_fn";
    static final String CHECK_VIOLATION = "23514";
    static final String UNIQUE_VIOLATION = "23505";

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    protected String quotePart(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public int getMaxIdentifierLength() {
        return 63;
    }

    /**
     * Postgres indexes live in the schema namespace, so the owner table's schema qualifies the name.
     */
    @Override
    public String getDropIndexSql(IndexModel idx) {
        return "DROP INDEX " + quoteIdentifier(inOwnerSchema(idx.getTableName(), idx.getIndexName()));
    }

    @Override
    public List<DdlStatement> getCreateExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        String function = inOwnerSchema(check.getOwnerTable(), naming.withSuffix(check.getTriggerName(), FUNCTION_SUFFIX));
        String createFunction = "CREATE OR REPLACE FUNCTION " + quoteIdentifier(function) + "() RETURNS trigger AS $$\n"
                + functionBody(check)
                + "$$ LANGUAGE plpgsql";
        String createTrigger = "CREATE TRIGGER " + quoteIdentifier(check.getTriggerName())
                + " BEFORE INSERT OR UPDATE ON " + quoteIdentifier(check.getOwnerTable())
                + " FOR EACH ROW EXECUTE FUNCTION " + quoteIdentifier(function) + "()";
        return List.of(
                new DdlStatement(DdlObjectKind.FUNCTION, function, createFunction),
                new DdlStatement(DdlObjectKind.TRIGGER, check.getTriggerName(), createTrigger));
    }

    @Override
    public List<DdlStatement> getDropExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        String function = inOwnerSchema(check.getOwnerTable(), naming.withSuffix(check.getTriggerName(), FUNCTION_SUFFIX));
        return List.of(
                new DdlStatement(DdlObjectKind.TRIGGER, check.getTriggerName(),
                        "DROP TRIGGER " + quoteIdentifier(check.getTriggerName())
                                + " ON " + quoteIdentifier(check.getOwnerTable())),
                new DdlStatement(DdlObjectKind.FUNCTION, function,
                        "DROP FUNCTION " + quoteIdentifier(function) + "()"));
    }

    private String functionBody(ExclusivityCheck check) {
        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN\n");
        sb.append("    IF num_nonnulls(").append(String.join(", ", newRowRefs(check.getColumns())))
                .append(") <> ").append(check.expectedCount()).append(" THEN\n");
        sb.append("        ").append(raise(check.getMessage(), CHECK_VIOLATION)).append('\n');
        sb.append("    END IF;\n");
        if (check.isUniqueAcrossColumns()) {
            String pk = quoteIdentifier(check.getOwnerPrimaryKey());
            sb.append("    IF EXISTS (SELECT 1 FROM ").append(quoteIdentifier(check.getOwnerTable()))
                    .append(" WHERE ").append(sameActiveValuePredicate(check.getColumns()))
                    .append(" AND ").append(pk).append(" IS DISTINCT FROM NEW.").append(pk).append(") THEN\n");
            sb.append("        ").append(raise(check.getUniqueMessage(), UNIQUE_VIOLATION)).append('\n');
            sb.append("    END IF;\n");
        }
        sb.append("    RETURN NEW;\n");
        sb.append("END;\n");
        return sb.toString();
    }

    private String raise(String message, String errcode) {
        // RAISE 포맷 문자열에서 % 는 자리표시자
        return "RAISE EXCEPTION " + quoteLiteral(message.replace("%", "%%")) + " USING ERRCODE = '" + errcode + "';";
    }
}
