package org.tablesmith.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectDefinitionJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ProjectDefinition definition;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/definitions/shop.json")) {
            definition = mapper.readValue(in, ProjectDefinition.class);
        }
    }

    @Test
    @DisplayName("Reads project attributes and ignores unknown sections")
    void readsProjectAttributes() {
        assertThat(definition.getName()).isEqualTo("Shop");
        assertThat(definition.getProjectFolder()).isEqualTo("shop");
        assertThat(definition.getDatabase().getType()).isEqualTo(DatabaseType.ORACLE);
        assertThat(definition.getDatabase().getTables()).extracting(TableModel::getName)
                .containsExactly("orders", "customers");
    }

    @Test
    @DisplayName("Maps isPrimaryKey, foreign key and default attributes")
    void mapsFieldFlags() {
        TableModel orders = definition.getDatabase().findTable("ORDERS").orElseThrow();

        FieldModel id = orders.findField("id").orElseThrow();
        assertThat(id.isPrimaryKey()).isTrue();
        assertThat(id.isNullable()).isFalse();

        FieldModel customerId = orders.findField("customer_id").orElseThrow();
        assertThat(customerId.hasForeignKeyReference()).isTrue();
        assertThat(customerId.getForeignKeyRef().getReferencedTable()).isEqualTo("customers");

        assertThat(orders.findField("created_at").orElseThrow().getDefaultValue()).isEqualTo("systimestamp");
        assertThat(orders.findField("total_amount").orElseThrow().isNullable()).isTrue();
    }

    @Test
    @DisplayName("The isForeignKey flag and the foreignKey reference bind to separate members")
    void foreignKeyFlagAndReference() throws IOException {
        FieldModel field = mapper.readValue("""
                { "name": "customer_id", "type": "NUMBER", "isPrimaryKey": false, "isForeignKey": true,
                  "foreignKey": { "referencedTable": "customers", "referencedColumn": "id" } }
                """, FieldModel.class);

        assertThat(field.isForeignKey()).isTrue();
        assertThat(field.isPrimaryKey()).isFalse();
        assertThat(field.getForeignKeyRef())
                .extracting(ForeignKeyRef::getReferencedTable, ForeignKeyRef::getReferencedColumn)
                .containsExactly("customers", "id");
        assertThat(field.hasForeignKeyReference()).isTrue();
    }

    @Test
    @DisplayName("Keeps numeric and text allowed values apart")
    void allowedValuesKeepTheirKind() {
        FieldModel priority = definition.getDatabase().findTable("orders").orElseThrow()
                .findField("priority").orElseThrow();
        FieldModel status = definition.getDatabase().findTable("customers").orElseThrow()
                .findField("status").orElseThrow();

        assertThat(priority.getAllowedValues()).allMatch(AllowedValue::isNumeric)
                .extracting(AllowedValue::getText).containsExactly("1", "2", "3");
        assertThat(status.getAllowedValues()).noneMatch(AllowedValue::isNumeric)
                .extracting(AllowedValue::getText).containsExactly("ACTIVE", "INACTIVE");
    }

    @Test
    @DisplayName("Trigger events use their lower-case codes")
    void triggerEvent() {
        TriggerModel trigger = definition.getDatabase().findTable("customers").orElseThrow()
                .findField("updated_at").orElseThrow().getTrigger();

        assertThat(trigger.isEnabled()).isTrue();
        assertThat(trigger.effectiveEvent()).isEqualTo(TriggerEvent.BEFORE_UPDATE);
        assertThat(TriggerEvent.fromCode("after_insert_update").operationClause()).isEqualTo("INSERT OR UPDATE");
        assertThat(TriggerEvent.fromCode(null)).isEqualTo(TriggerEvent.BEFORE_UPDATE);
    }

    @Test
    @DisplayName("Missing trigger action and event fall back to defaults")
    void triggerDefaults() {
        TriggerModel trigger = TriggerModel.builder().enabled(true).condition("  ").build();

        assertThat(trigger.effectiveEvent()).isEqualTo(TriggerEvent.BEFORE_UPDATE);
        assertThat(trigger.effectiveAction()).isEqualTo("systimestamp");
        assertThat(trigger.effectiveCondition()).isNull();
    }

    @Test
    @DisplayName("Metadata falls back to Joe Doe / MIT")
    void metadataDefaults() {
        ProjectMetadata fromFile = definition.toMetadata();
        ProjectMetadata empty = ProjectDefinition.builder().build().toMetadata();

        assertThat(fromFile.getAuthor()).isEqualTo("Ada Lovelace");
        assertThat(fromFile.getLicense()).isEqualTo("Apache-2.0");
        assertThat(empty.getAuthor()).isEqualTo("Joe Doe");
        assertThat(empty.getLicense()).isEqualTo("MIT");
    }

    @Test
    @DisplayName("Rejects database types other than Oracle")
    void unsupportedDatabaseType() {
        assertThatThrownBy(() -> DatabaseType.fromValue("mysql"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mysql");
        assertThat(DatabaseType.fromValue("oracle")).isEqualTo(DatabaseType.ORACLE);
    }

    @Test
    @DisplayName("Artifact file names carry a zero-padded order")
    void orderedFileName() {
        ScriptArtifact artifact = new ScriptArtifact(ArtifactCategory.VIEWS, "oracle", "customers_v", 7, "");

        assertThat(artifact.orderedFileName()).isEqualTo("007_customers_v.sql");
    }
}
