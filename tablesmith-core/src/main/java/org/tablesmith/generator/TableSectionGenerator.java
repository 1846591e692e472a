package org.tablesmith.generator;

import org.tablesmith.model.TableModel;

import java.util.Optional;

public class TableSectionGenerator extends AbstractSectionGenerator {

    public TableSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        if (table.getFields() == null || table.getFields().isEmpty()) {
            throw new IllegalArgumentException("Table " + table.getName() + " has no fields");
        }
        String ddl = new CreateTableBuilder(table.getName(), dialect())
                .defaultsFrom(table)
                .build();
        return section(ddl);
    }

    @Override
    public String sectionName() {
        return "TABLE DEFINITION";
    }

    @Override
    public String sectionDescription() {
        return "Main table structure with columns and data types";
    }
}
