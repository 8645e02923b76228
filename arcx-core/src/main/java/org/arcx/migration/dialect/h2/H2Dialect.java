package org.arcx.migration.dialect.h2;

import org.arcx.migration.AbstractDialect;
import org.arcx.migration.DatabaseType;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.IndexModel;
import org.arcx.naming.Naming;

import java.util.List;
import java.util.stream.Collectors;

/**
 * H2 2.x. H2 has no procedural SQL, so the trigger is Java source compiled by the database that
 * instantiates {@link H2ExclusivityTrigger} with the checked columns.
 */
public class H2Dialect extends AbstractDialect {

    // 문자열로 둔다. h2 는 optional 의존성이라 SQL 생성만 할 때는 클래스패스에 없을 수 있다
    static final String TRIGGER_CLASS = "org.arcx.migration.dialect.h2.H2ExclusivityTrigger";

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.H2;
    }

    @Override
    protected String quotePart(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public int getMaxIdentifierLength() {
        return 256;
    }

    /**
     * H2 indexes live in the schema namespace, so the owner table's schema qualifies the name.
     */
    @Override
    public String getDropIndexSql(IndexModel idx) {
        return "DROP INDEX " + quoteIdentifier(inOwnerSchema(idx.getTableName(), idx.getIndexName()));
    }

    @Override
    public List<DdlStatement> getCreateExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        String columns = check.getColumns().stream()
                .map(H2Dialect::javaString)
                .collect(Collectors.joining(", "));
        String source = "org.h2.api.Trigger create() { return new " + TRIGGER_CLASS + "("
                + javaString(check.getMessage()) + ", "
                + (check.isUniqueAcrossColumns() ? javaString(check.getUniqueMessage()) : "null") + ", "
                + javaString(check.getOwnerPrimaryKey()) + ", "
                + "new String[] {" + columns + "}); }";
        String sql = "CREATE TRIGGER " + quoteIdentifier(inOwnerSchema(check.getOwnerTable(), check.getTriggerName()))
                + " BEFORE INSERT, UPDATE ON " + quoteIdentifier(check.getOwnerTable())
                + " FOR EACH ROW AS $$" + source + "$$";
        return List.of(new DdlStatement(DdlObjectKind.TRIGGER, check.getTriggerName(), sql));
    }

    @Override
    public List<DdlStatement> getDropExclusivityTriggerSql(ExclusivityCheck check, Naming naming) {
        return List.of(new DdlStatement(DdlObjectKind.TRIGGER, check.getTriggerName(),
                "DROP TRIGGER " + quoteIdentifier(inOwnerSchema(check.getOwnerTable(), check.getTriggerName()))));
    }

    static String javaString(String raw) {
        StringBuilder sb = new StringBuilder("\"");
        for (char ch : raw.toCharArray()) {
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '$' -> sb.append("\\u0024"); // $$ 문자열 종료 방지
                default -> sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }
}
