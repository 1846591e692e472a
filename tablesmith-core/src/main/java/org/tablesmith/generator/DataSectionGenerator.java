package org.tablesmith.generator;

import org.tablesmith.generator.seed.SeedValueGenerator;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Seed rows for development databases. Needs a primary key so foreign keys of child tables
 * can point at the emitted rows.
 */
public class DataSectionGenerator extends AbstractSectionGenerator {
    private final SeedValueGenerator seedValues;

    public DataSectionGenerator(GenerationContext context) {
        this(context, new SeedValueGenerator(context.getDialect()));
    }

    public DataSectionGenerator(GenerationContext context, SeedValueGenerator seedValues) {
        super(context);
        this.seedValues = seedValues;
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        if (!table.hasPrimaryKey()) {
            return Optional.empty();
        }

        // defaults and triggers fill these
        List<FieldModel> columns = table.getFields().stream()
                .filter(f -> f.isPrimaryKey() || !FieldRoles.isDatabaseManaged(f, dialect()))
                .toList();

        List<List<String>> values = new ArrayList<>();
        for (FieldModel f : columns) {
            values.add(seedValues.columnValues(table, f));
        }

        String tableId = id(table.getName());
        String columnList = String.join(", ", columns.stream().map(f -> id(f.getName())).toList());
        StringBuilder sb = new StringBuilder()
                .append("-- ").append(seedValues.getRowCount()).append(" sample rows for ").append(tableId).append('\n');
        for (int row = 0; row < seedValues.getRowCount(); row++) {
            List<String> rowValues = new ArrayList<>(columns.size());
            for (List<String> column : values) {
                rowValues.add(column.get(row));
            }
            sb.append("INSERT INTO ").append(tableId).append(" (").append(columnList).append(")\n")
                    .append(indent(1)).append("VALUES (").append(String.join(", ", rowValues)).append(");\n");
        }
        sb.append("\nCOMMIT;");
        return section(sb.toString());
    }

    @Override
    public String sectionName() {
        return "INITIAL DATA";
    }

    @Override
    public String sectionDescription() {
        return "Sample records for development and testing";
    }
}
