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
public class TriggerModel {
    public static final String DEFAULT_ACTION = "systimestamp";

    @Builder.Default private boolean enabled = false;
    @Builder.Default private TriggerEvent event = null;
    @Builder.Default private String action = null;
    @Builder.Default private String condition = null;

    public TriggerEvent effectiveEvent() {
        return event != null ? event : TriggerEvent.BEFORE_UPDATE;
    }

    public String effectiveAction() {
        return action == null || action.isBlank() ? DEFAULT_ACTION : action.trim();
    }

    /** Trimmed condition, or null when none was given. */
    public String effectiveCondition() {
        return condition == null || condition.isBlank() ? null : condition.trim();
    }
}
