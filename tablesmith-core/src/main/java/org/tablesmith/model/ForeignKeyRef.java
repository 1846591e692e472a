package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForeignKeyRef {
    private String referencedTable;
    private String referencedColumn;

    public boolean isComplete() {
        return referencedTable != null && !referencedTable.isBlank()
                && referencedColumn != null && !referencedColumn.isBlank();
    }
}
