package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldModel {
    private String name;
    private String type;
    @Builder.Default private boolean nullable = true;
    // Lombok derives isPrimaryKey()/isForeignKey() from these; the JSON names keep their "is" prefix
    @Builder.Default
    @JsonProperty("isPrimaryKey")
    private boolean primaryKey = false;
    @Builder.Default
    @JsonProperty("isForeignKey")
    private boolean foreignKey = false;
    @Builder.Default
    @JsonProperty("foreignKey")
    private ForeignKeyRef foreignKeyRef = null;
    @Builder.Default private boolean unique = false;
    @Builder.Default
    @JsonProperty("default")
    private String defaultValue = null;
    @Builder.Default private List<AllowedValue> allowedValues = new ArrayList<>();
    @Builder.Default private String comment = null;
    @Builder.Default private TriggerModel trigger = null;

    public boolean hasAllowedValues() {
        return allowedValues != null && !allowedValues.isEmpty();
    }

    /** True when the field is flagged as a foreign key and carries a complete reference. */
    public boolean hasForeignKeyReference() {
        return foreignKey && foreignKeyRef != null && foreignKeyRef.isComplete();
    }

    public boolean hasEnabledTrigger() {
        return trigger != null && trigger.isEnabled();
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isBlank();
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
