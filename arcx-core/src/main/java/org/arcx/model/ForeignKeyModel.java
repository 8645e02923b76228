package org.arcx.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ForeignKeyModel {
    String name;
    String tableName;
    String column;
    String referencedTable;
    String referencedColumn;
    @Builder.Default OnDeleteAction onDelete = OnDeleteAction.NO_ACTION;
}
