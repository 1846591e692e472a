package org.tablesmith.resolver;

import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders tables so that every table is created after the tables its foreign keys point to.
 *
 * <p>Depth-first topological sort over {@code referencingTo}, visiting tables and edges in input order.
 * A back edge to a table still in progress is a cycle: it is reported and that edge is not followed,
 * so every table still appears exactly once. References to tables outside the schema are ignored.
 */
public class DependencyResolver {

    public Resolution resolve(List<TableModel> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("Schema must contain at least one table");
        }

        Map<String, TableModel> byKey = new LinkedHashMap<>();
        for (TableModel table : tables) {
            if (table == null || table.getName() == null || table.getName().isBlank()) {
                throw new IllegalArgumentException("Every table must have a name");
            }
            if (byKey.putIfAbsent(key(table.getName()), table) != null) {
                throw new IllegalArgumentException("Duplicate table name: " + table.getName());
            }
        }

        List<TableModel> ordered = new ArrayList<>(tables.size());
        List<String> warnings = new ArrayList<>();
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();

        for (TableModel table : tables) {
            visit(table, byKey, visiting, visited, ordered, warnings);
        }

        return new Resolution(List.copyOf(ordered), List.copyOf(warnings), explain(ordered, warnings));
    }

    private void visit(TableModel table, Map<String, TableModel> byKey, Set<String> visiting, Set<String> visited,
                       List<TableModel> ordered, List<String> warnings) {
        String k = key(table.getName());
        if (visited.contains(k)) {
            return;
        }
        if (visiting.contains(k)) {
            warnings.add("Circular dependency detected involving table: " + table.getName());
            return;
        }

        visiting.add(k);
        for (String dependency : table.referencingToOrEmpty()) {
            if (dependency == null) continue;
            TableModel target = byKey.get(key(dependency));
            // self references and unknown tables do not constrain the order
            if (target == null || target == table) continue;
            visit(target, byKey, visiting, visited, ordered, warnings);
        }
        visiting.remove(k);
        visited.add(k);
        ordered.add(table);
    }

    private String explain(List<TableModel> ordered, List<String> warnings) {
        StringBuilder sb = new StringBuilder("Tables sorted by dependencies: ")
                .append(ordered.stream().map(TableModel::getName).collect(Collectors.joining(" → ")))
                .append('\n')
                .append("Tables that are referenced by others are created first so that foreign keys always point to an existing table.");
        if (!warnings.isEmpty()) {
            sb.append('\n')
                    .append("Circular references were found; the order above breaks each cycle at the first table revisited.");
        }
        return sb.toString();
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
