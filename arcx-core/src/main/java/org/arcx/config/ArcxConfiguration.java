package org.arcx.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class ArcxConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("naming")
        private NamingConfiguration naming;

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("output")
        private OutputConfiguration output;
    }

    @Data
    public static class NamingConfiguration {

        @JsonProperty("maxLength")
        private Integer maxLength;
    }

    /**
     * 대상 데이터베이스. 트리거 문법이 dialect마다 다르다.
     */
    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("dialect")
        private String dialect;
    }

    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;
    }
}
