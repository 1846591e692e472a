package org.tablesmith.naming;

import org.tablesmith.model.TriggerEvent;

/**
 * Deterministic object names. Every name is a pure function of its arguments so repeated runs
 * produce identical scripts.
 */
public interface Naming {
    String pkName(String table);

    /**
     * @param field only used when the table holds several foreign keys to the same table, otherwise null
     */
    String fkName(String table, String referencedTable, String field);

    String ukName(String table, String field);

    String ckName(String table, String field);

    /**
     * @param conditionOrdinal 0 for an unconditional trigger, 1.. for the n-th conditional group of the event
     */
    String triggerName(String table, TriggerEvent event, int conditionOrdinal);

    String viewName(String table);

    String packageName(String table);

    /**
     * Alias for a column projected through a foreign key, {@code <FIELD>_<COLUMN>}.
     */
    String columnAlias(String field, String column);
}
