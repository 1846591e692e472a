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
public class SchemaModel {
    @Builder.Default private DatabaseType type = DatabaseType.ORACLE;
    @Builder.Default private List<TableModel> tables = new ArrayList<>();

    public Optional<TableModel> findTable(String tableName) {
        if (tableName == null || tables == null) return Optional.empty();
        return tables.stream()
                .filter(t -> tableName.equalsIgnoreCase(t.getName()))
                .findFirst();
    }
}
