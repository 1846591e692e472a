package org.tablesmith.cli.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ForeignKeyRef;
import org.tablesmith.model.ProjectDefinition;
import org.tablesmith.model.SchemaModel;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DefinitionValidatorTest {

    private final DefinitionValidator validator = new DefinitionValidator();

    private static FieldModel pk() {
        return FieldModel.builder().name("id").type("NUMBER(10)").primaryKey(true).nullable(false).build();
    }

    private static FieldModel fk(String name, String table, String column) {
        return FieldModel.builder().name(name).type("NUMBER(10)").foreignKey(true)
                .foreignKeyRef(ForeignKeyRef.builder().referencedTable(table).referencedColumn(column).build())
                .build();
    }

    private static TableModel table(String name, FieldModel... fields) {
        return TableModel.builder().name(name).fields(new ArrayList<>(List.of(fields))).build();
    }

    private static ProjectDefinition definition(TableModel... tables) {
        return ProjectDefinition.builder()
                .database(SchemaModel.builder().tables(new ArrayList<>(List.of(tables))).build())
                .build();
    }

    @Test
    @DisplayName("A well-formed definition has neither errors nor warnings")
    void valid() {
        ValidationReport report = validator.validate(definition(
                table("customers", pk()),
                table("orders", pk(), fk("customer_id", "customers", "id"))));

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Structural problems are errors")
    void errors() {
        FieldModel untyped = FieldModel.builder().name("label").build();
        ValidationReport report = validator.validate(definition(
                table("items", pk(), untyped, FieldModel.builder().name("ID").type("NUMBER").build()),
                table("empty"),
                table("Items", pk())));

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).containsExactly(
                "Field items.label has no type",
                "Duplicate field name: items.ID",
                "Table empty has no fields",
                "Duplicate table name: Items");
    }

    @Test
    @DisplayName("No tables at all is an error")
    void noTables() {
        assertThat(validator.validate(definition()).errors()).containsExactly("Definition contains no tables");
    }

    @Test
    @DisplayName("Dangling references, unknown types and missing keys are warnings")
    void warnings() {
        FieldModel odd = FieldModel.builder().name("payload").type("JSONB").build();
        FieldModel incomplete = FieldModel.builder().name("parent_id").type("NUMBER").foreignKey(true).build();
        ValidationReport report = validator.validate(definition(
                table("orders", pk(), fk("customer_id", "customers", "id"), fk("self_id", "orders", "code"), odd, incomplete),
                table("log", FieldModel.builder().name("message").type("VARCHAR2(200)").build())));

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).containsExactly(
                "Field orders.customer_id references unknown table customers",
                "Field orders.self_id references unknown column orders.code",
                "Field orders.payload has an unrecognized Oracle type: JSONB",
                "Field orders.parent_id is marked as foreign key but has no complete reference",
                "Table log has no primary key; seed data and CRUD package are skipped");
    }

    @Test
    void multipleSelfReferences() {
        ValidationReport report = validator.validate(definition(
                table("employees", pk(), fk("manager_id", "employees", "id"), fk("mentor_id", "employees", "id"))));

        assertThat(report.warnings()).containsExactly("Table employees has multiple self-referencing foreign keys");
    }

    @Test
    void oracleTypes() {
        assertThat(DefinitionValidator.isKnownOracleType("varchar2(10)")).isTrue();
        assertThat(DefinitionValidator.isKnownOracleType("TIMESTAMP WITH LOCAL TIME ZONE")).isTrue();
        assertThat(DefinitionValidator.isKnownOracleType("INTERVAL DAY TO SECOND")).isTrue();
        assertThat(DefinitionValidator.isKnownOracleType("TEXT")).isFalse();
    }
}
