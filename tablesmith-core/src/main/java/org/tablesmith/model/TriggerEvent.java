package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

public enum TriggerEvent {
    BEFORE_INSERT("before_insert", "BEFORE", List.of("INSERT"), "BI"),
    BEFORE_UPDATE("before_update", "BEFORE", List.of("UPDATE"), "BU"),
    BEFORE_INSERT_UPDATE("before_insert_update", "BEFORE", List.of("INSERT", "UPDATE"), "BIU"),
    AFTER_INSERT("after_insert", "AFTER", List.of("INSERT"), "AI"),
    AFTER_UPDATE("after_update", "AFTER", List.of("UPDATE"), "AU"),
    AFTER_INSERT_UPDATE("after_insert_update", "AFTER", List.of("INSERT", "UPDATE"), "AIU");

    private final String code;
    private final String timing;
    private final List<String> operations;
    private final String abbreviation;

    TriggerEvent(String code, String timing, List<String> operations, String abbreviation) {
        this.code = code;
        this.timing = timing;
        this.operations = operations;
        this.abbreviation = abbreviation;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTiming() {
        return timing;
    }

    public List<String> getOperations() {
        return operations;
    }

    /** e.g. {@code INSERT OR UPDATE} */
    public String operationClause() {
        return String.join(" OR ", operations);
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public boolean isAfter() {
        return "AFTER".equals(timing);
    }

    @JsonCreator
    public static TriggerEvent fromCode(String code) {
        if (code == null || code.isBlank()) {
            return BEFORE_UPDATE;
        }
        String c = code.trim();
        return Arrays.stream(values())
                .filter(e -> e.code.equalsIgnoreCase(c) || e.name().equalsIgnoreCase(c))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger event: " + code));
    }
}
