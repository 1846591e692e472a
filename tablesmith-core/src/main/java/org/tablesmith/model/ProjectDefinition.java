package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of a project definition file. Only the {@code database} block drives generation;
 * the remaining attributes end up in script headers and the output layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectDefinition {
    private String name;
    private String version;
    private String description;
    private String author;
    private String license;
    private String projectFolder;
    private SchemaModel database;

    public ProjectMetadata toMetadata() {
        return ProjectMetadata.of(author, license, description);
    }
}
