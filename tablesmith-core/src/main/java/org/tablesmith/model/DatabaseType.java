package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DatabaseType {
    ORACLE("Oracle", "oracle");

    private final String displayName;
    private final String folder;

    DatabaseType(String displayName, String folder) {
        this.displayName = displayName;
        this.folder = folder;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Folder name used as the artifact sub-category for this dialect.
     */
    public String getFolder() {
        return folder;
    }

    @JsonCreator
    public static DatabaseType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ORACLE;
        }
        return Arrays.stream(values())
                .filter(t -> t.displayName.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported database type: " + value));
    }
}
