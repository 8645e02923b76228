package org.arcx.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexModel {
    String indexName;
    String tableName;
    String column;
}
