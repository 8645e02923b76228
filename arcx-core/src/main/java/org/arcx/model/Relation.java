package org.arcx.model;

import lombok.Builder;
import lombok.Value;
import org.arcx.naming.Inflector;

/**
 * One arm of an exclusive arc: a nullable foreign-key column on the owner table and the
 * table/column it references.
 */
@Value
@Builder(toBuilder = true)
public class Relation {
    String column;
    String referencedTable;
    @Builder.Default String referencedColumn = "id";
    /** 짧은 관계 이름. 비어 있으면 참조 테이블 이름에서 유도한다. */
    String name;
    @Builder.Default OnDeleteAction onDelete = OnDeleteAction.NO_ACTION;
    /** false면 컬럼에 이미 인덱스가 있다고 보고 생성/삭제하지 않는다. */
    @Builder.Default boolean indexed = true;

    public static Relation of(String column, String referencedTable, String referencedColumn) {
        return Relation.builder()
                .column(column)
                .referencedTable(referencedTable)
                .referencedColumn(referencedColumn)
                .build();
    }

    /**
     * Human-facing name of the relation, e.g. {@code employee} for {@code employees}.
     */
    public String shortName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return Inflector.singularize(referencedTable);
    }
}
