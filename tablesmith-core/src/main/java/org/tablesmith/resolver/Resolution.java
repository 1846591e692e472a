package org.tablesmith.resolver;

import org.tablesmith.model.TableModel;

import java.util.List;

/**
 * Creation order chosen by {@link DependencyResolver}.
 *
 * @param orderedTables input tables, parents before children
 * @param warnings      cycle diagnostics
 * @param explanation   human readable summary of the order
 */
public record Resolution(List<TableModel> orderedTables, List<String> warnings, String explanation) {

    public List<String> tableNames() {
        return orderedTables.stream().map(TableModel::getName).toList();
    }
}
