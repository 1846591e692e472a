package org.tablesmith.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Author/license/description printed into every script header.
 */
@Getter
@Builder(toBuilder = true)
public class ProjectMetadata {
    public static final String DEFAULT_AUTHOR = "Joe Doe";
    public static final String DEFAULT_LICENSE = "MIT";

    @Builder.Default private final String author = DEFAULT_AUTHOR;
    @Builder.Default private final String license = DEFAULT_LICENSE;
    @Builder.Default private final String description = null;

    public static ProjectMetadata defaults() {
        return ProjectMetadata.builder().build();
    }

    /** Blank values fall back to the defaults. */
    public static ProjectMetadata of(String author, String license, String description) {
        return ProjectMetadata.builder()
                .author(author == null || author.isBlank() ? DEFAULT_AUTHOR : author.trim())
                .license(license == null || license.isBlank() ? DEFAULT_LICENSE : license.trim())
                .description(description == null || description.isBlank() ? null : description.trim())
                .build();
    }
}
