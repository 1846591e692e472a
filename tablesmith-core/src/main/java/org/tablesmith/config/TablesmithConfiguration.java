package org.tablesmith.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TablesmithConfiguration {

    /**
     * Settings per profile name.
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("naming")
        private NamingConfiguration naming;

        @JsonProperty("format")
        private FormatConfiguration format;

        @JsonProperty("output")
        private OutputConfiguration output;

        @JsonProperty("metadata")
        private MetadataConfiguration metadata;
    }

    @Data
    public static class NamingConfiguration {

        @JsonProperty("maxLength")
        private Integer maxLength;
    }

    @Data
    public static class FormatConfiguration {

        @JsonProperty("indentSize")
        private Integer indentSize;

        @JsonProperty("includeTimestamps")
        private Boolean includeTimestamps;
    }

    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;
    }

    @Data
    public static class MetadataConfiguration {

        @JsonProperty("author")
        private String author;

        @JsonProperty("license")
        private String license;
    }
}
