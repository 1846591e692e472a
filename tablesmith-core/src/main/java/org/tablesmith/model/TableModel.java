package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableModel {
    private String name;
    @Builder.Default private List<FieldModel> fields = new ArrayList<>();
    @Builder.Default private List<String> referencingTo = new ArrayList<>();
    @Builder.Default private List<String> referencedBy = new ArrayList<>();

    public List<FieldModel> primaryKeyFields() {
        return fields.stream().filter(FieldModel::isPrimaryKey).toList();
    }

    public boolean hasPrimaryKey() {
        return fields.stream().anyMatch(FieldModel::isPrimaryKey);
    }

    /** Oracle identifiers are case-insensitive, so the lookup is too. */
    public Optional<FieldModel> findField(String fieldName) {
        if (fieldName == null) return Optional.empty();
        return fields.stream()
                .filter(f -> fieldName.equalsIgnoreCase(f.getName()))
                .findFirst();
    }

    public List<String> referencingToOrEmpty() {
        return referencingTo == null ? List.of() : referencingTo;
    }
}
