package org.arcx.config.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson view of a mapping declaration file.
 */
@Data
public class MappingFile {

    @JsonProperty("mappings")
    private List<MappingDefinition> mappings = new ArrayList<>();

    /**
     * 참조 테이블별 PK/UNIQUE 컬럼 선언 (선택)
     */
    @JsonProperty("referencedKeys")
    private Map<String, List<String>> referencedKeys = new LinkedHashMap<>();

    @Data
    public static class MappingDefinition {

        @JsonProperty("table")
        private String table;

        @JsonProperty("primaryKey")
        private String primaryKey;

        @JsonProperty("role")
        private String role;

        @JsonProperty("relations")
        private List<RelationDefinition> relations = new ArrayList<>();

        @JsonProperty("options")
        private OptionsDefinition options;
    }

    @Data
    public static class RelationDefinition {

        @JsonProperty("column")
        private String column;

        /**
         * {@code table.column} 축약형. referencedTable/referencedColumn 과 함께 쓰지 않는다.
         */
        @JsonProperty("references")
        private String references;

        @JsonProperty("referencedTable")
        private String referencedTable;

        @JsonProperty("referencedColumn")
        private String referencedColumn;

        @JsonProperty("name")
        private String name;

        @JsonProperty("onDelete")
        private String onDelete;

        @JsonProperty("indexed")
        private Boolean indexed;
    }

    @Data
    public static class OptionsDefinition {

        @JsonProperty("uniqueAcrossColumns")
        private boolean uniqueAcrossColumns;

        @JsonProperty("indexNamePrefix")
        private String indexNamePrefix;

        @JsonProperty("foreignKeyNamePrefix")
        private String foreignKeyNamePrefix;
    }
}
