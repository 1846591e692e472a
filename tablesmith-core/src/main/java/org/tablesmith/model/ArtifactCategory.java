package org.tablesmith.model;

public enum ArtifactCategory {
    TABLES("tables"),
    VIEWS("views"),
    DATA("data"),
    PACKAGES("packages");

    private final String folder;

    ArtifactCategory(String folder) {
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
