package org.tablesmith.dialect;

/**
 * Coarse classification of a column type, used for seed values, view formatting and CRUD search.
 */
public enum TypeCategory {
    TEXT,
    LOB,
    NUMBER,
    DATE,
    TIMESTAMP,
    BOOLEAN,
    OTHER;

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    public boolean isSearchable() {
        return this == TEXT || this == LOB;
    }
}
