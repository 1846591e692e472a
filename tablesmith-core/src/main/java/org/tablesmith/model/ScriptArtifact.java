package org.tablesmith.model;

/**
 * A finished script ready to be persisted.
 *
 * @param category    script family, doubles as the output folder
 * @param subCategory dialect folder, e.g. {@code oracle}
 * @param fileName    base file name without order prefix or extension
 * @param order       1-based creation order of the owning table
 * @param content     full script text
 */
public record ScriptArtifact(ArtifactCategory category, String subCategory, String fileName, int order, String content) {

    /** {@code 001_CUSTOMERS.sql} */
    public String orderedFileName() {
        return String.format("%03d_%s.sql", order, fileName);
    }
}
