package org.tablesmith.cli.service;

import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ForeignKeyRef;
import org.tablesmith.model.ProjectDefinition;
import org.tablesmith.model.SchemaModel;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a project definition before generation.
 *
 * <p>Structural problems the generators cannot work around (duplicate names, fields without a type,
 * tables without fields) are errors. Everything the generators skip with a warning of their own
 * (dangling foreign keys, unknown column types) is reported here as a warning too, so the user sees
 * it before any file is written.
 */
public class DefinitionValidator {

    private static final List<String> ORACLE_TYPES = List.of(
            "NUMBER", "INTEGER", "FLOAT", "BINARY_FLOAT", "BINARY_DOUBLE",
            "VARCHAR2", "NVARCHAR2", "CHAR", "NCHAR", "CLOB", "NCLOB",
            "DATE", "TIMESTAMP", "INTERVAL YEAR", "INTERVAL DAY",
            "RAW", "LONG", "BLOB", "BFILE", "ROWID", "UROWID", "BOOLEAN");

    public ValidationReport validate(ProjectDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        SchemaModel schema = definition.getDatabase();
        if (schema == null || schema.getTables() == null || schema.getTables().isEmpty()) {
            errors.add("Definition contains no tables");
            return new ValidationReport(errors, warnings);
        }

        Set<String> tableNames = new HashSet<>();
        for (TableModel table : schema.getTables()) {
            if (isBlank(table.getName())) {
                errors.add("Table without a name");
                continue;
            }
            if (!tableNames.add(key(table.getName()))) {
                errors.add("Duplicate table name: " + table.getName());
            }
            validateTable(table, schema, errors, warnings);
        }
        return new ValidationReport(errors, warnings);
    }

    private void validateTable(TableModel table, SchemaModel schema, List<String> errors, List<String> warnings) {
        String tableName = table.getName();
        if (table.getFields() == null || table.getFields().isEmpty()) {
            errors.add("Table " + tableName + " has no fields");
            return;
        }

        Set<String> fieldNames = new HashSet<>();
        int selfReferences = 0;
        for (FieldModel field : table.getFields()) {
            if (isBlank(field.getName())) {
                errors.add("Table " + tableName + " has a field without a name");
                continue;
            }
            String qualified = tableName + "." + field.getName();
            if (!fieldNames.add(key(field.getName()))) {
                errors.add("Duplicate field name: " + qualified);
            }
            if (isBlank(field.getType())) {
                errors.add("Field " + qualified + " has no type");
            } else if (!isKnownOracleType(field.getType())) {
                warnings.add("Field " + qualified + " has an unrecognized Oracle type: " + field.getType());
            }

            if (field.isForeignKey()) {
                ForeignKeyRef ref = field.getForeignKeyRef();
                if (ref == null || !ref.isComplete()) {
                    warnings.add("Field " + qualified + " is marked as foreign key but has no complete reference");
                    continue;
                }
                if (ref.getReferencedTable().equalsIgnoreCase(tableName)) {
                    selfReferences++;
                }
                Optional<TableModel> target = schema.findTable(ref.getReferencedTable());
                if (target.isEmpty()) {
                    warnings.add("Field " + qualified + " references unknown table " + ref.getReferencedTable());
                } else if (target.get().findField(ref.getReferencedColumn()).isEmpty()) {
                    warnings.add("Field " + qualified + " references unknown column "
                            + ref.getReferencedTable() + "." + ref.getReferencedColumn());
                }
            }
        }

        if (!table.hasPrimaryKey()) {
            warnings.add("Table " + tableName + " has no primary key; seed data and CRUD package are skipped");
        }
        if (selfReferences > 1) {
            warnings.add("Table " + tableName + " has multiple self-referencing foreign keys");
        }
    }

    static boolean isKnownOracleType(String type) {
        String upper = type.trim().toUpperCase(Locale.ROOT);
        return ORACLE_TYPES.stream().anyMatch(upper::startsWith);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
