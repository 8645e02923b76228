package org.arcx.migration.dialect.mysql;

import org.arcx.migration.AbstractDialect;
import org.arcx.migration.DatabaseType;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.ForeignKeyModel;
import org.arcx.model.IndexModel;
import org.arcx.model.OnDeleteAction;
import org.arcx.naming.Naming;

import java.util.List;

public class MySqlDialect extends AbstractDialect {

    static final String INSERT_SUFFIX = "_bi";
    static final String UPDATE_SUFFIX = "_bu";
    // SIGNAL MESSAGE_TEXT 최대 길이
    static final int MAX_MESSAGE_LENGTH = 128;

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }

    @Override
    protected String quotePart(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public int getMaxIdentifierLength() {
        return 64; // MySQL identifier limit
    }

    @Override
    public String getDropForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.getTableName())
                + " DROP FOREIGN KEY " + quoteIdentifier(fk.getName());
    }

    @Override
    public String getDropIndexSql(IndexModel idx) {
        if (idx.getIndexName() == null || idx.getIndexName().isBlank()) {
            throw new IllegalArgumentException("Index name must not be null/blank");
        }
        return "DROP INDEX " + quoteIdentifier(idx.getIndexName()) + " ON " + quoteIdentifier(idx.getTableName());
    }

    @Override
    protected String unsupportedOnDelete(OnDeleteAction action) {
        return switch (action) {
            // InnoDB에서는 FK cascade 동작이 트리거를 실행하지 않는다
            case SET_NULL -> "cascaded foreign key actions do not fire triggers, the exclusivity check would be bypassed";
            case SET_DEFAULT -> "InnoDB rejects SET DEFAULT referential actions";
            default -> super.unsupportedOnDelete(action);
        };
    }

    // TriggerDialect: MySQL triggers fire on a single event, so one trigger per event.

    @Override
    public List<DdlStatement> getCreateExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        String body = triggerBody(check);
        return List.of(
                createTrigger(naming.withSuffix(check.getTriggerName(), INSERT_SUFFIX), "INSERT", check.getOwnerTable(), body),
                createTrigger(naming.withSuffix(check.getTriggerName(), UPDATE_SUFFIX), "UPDATE", check.getOwnerTable(), body));
    }

    @Override
    public List<DdlStatement> getDropExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        return List.of(
                dropTrigger(naming.withSuffix(check.getTriggerName(), INSERT_SUFFIX), check.getOwnerTable()),
                dropTrigger(naming.withSuffix(check.getTriggerName(), UPDATE_SUFFIX), check.getOwnerTable()));
    }

    /**
     * Trigger bodies contain ';', so the mysql client needs a temporary delimiter around them.
     */
    @Override
    public String renderScript(List<DdlStatement> statements) {
        StringBuilder sb = new StringBuilder();
        for (DdlStatement s : statements) {
            if (sb.length() > 0) sb.append('\n');
            if (s.kind() == DdlObjectKind.TRIGGER && s.sql().startsWith("CREATE")) {
                sb.append("DELIMITER //\n").append(s.sql()).append(" //\nDELIMITER ;\n");
            } else {
                sb.append(s.sql()).append(";\n");
            }
        }
        return sb.toString();
    }

    // MySQL 트리거는 테이블과 같은 스키마에 있어야 한다
    private DdlStatement createTrigger(String name, String event, String table, String body) {
        String sql = "CREATE TRIGGER " + quoteIdentifier(inOwnerSchema(table, name))
                + " BEFORE " + event + " ON " + quoteIdentifier(table) + " FOR EACH ROW\n"
                + body;
        return new DdlStatement(DdlObjectKind.TRIGGER, name, sql);
    }

    private DdlStatement dropTrigger(String name, String table) {
        return new DdlStatement(DdlObjectKind.TRIGGER, name, "DROP TRIGGER " + quoteIdentifier(inOwnerSchema(table, name)));
    }

    private String triggerBody(ExclusivityCheck check) {
        // MySQL에서 IS NOT NULL 은 0/1 을 반환하므로 그대로 더한다
        String count = newRowRefs(check.getColumns()).stream()
                .map(ref -> "(" + ref + " IS NOT NULL)")
                .reduce((a, b) -> a + " + " + b)
                .orElse("0");

        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN\n");
        sb.append("    IF (").append(count).append(") <> ").append(check.expectedCount()).append(" THEN\n");
        sb.append("        ").append(signal(check.getMessage())).append('\n');
        sb.append("    END IF;\n");
        if (check.isUniqueAcrossColumns()) {
            String pk = quoteIdentifier(check.getOwnerPrimaryKey());
            sb.append("    IF EXISTS (SELECT 1 FROM ").append(quoteIdentifier(check.getOwnerTable()))
                    .append(" WHERE ").append(sameActiveValuePredicate(check.getColumns()))
                    .append(" AND NOT (").append(pk).append(" <=> NEW.").append(pk).append(")) THEN\n");
            sb.append("        ").append(signal(check.getUniqueMessage())).append('\n');
            sb.append("    END IF;\n");
        }
        sb.append("END");
        return sb.toString();
    }

    private String signal(String message) {
        String text = message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) : message;
        return "SIGNAL SQLSTATE '45000' SET MESSAGE_TEXT = " + quoteLiteral(text) + ";";
    }
}
