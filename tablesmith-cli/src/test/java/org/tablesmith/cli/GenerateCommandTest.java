package org.tablesmith.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private Path outputDir;
    private Path configDir;

    @BeforeEach
    void setUp() throws IOException {
        outputDir = tempDir.resolve("out");
        configDir = Files.createDirectories(tempDir.resolve("config"));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(GenerateCommandTest.class.getResource("/definitions/" + name).toURI());
    }

    private int execute(String... args) {
        return new CommandLine(new GenerateCommand()).execute(args);
    }

    @Test
    @DisplayName("Writes every script into the category folders")
    void writesScripts() throws Exception {
        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", resource("shop.json").toString(),
                    "--out", outputDir.toString(), "--config-dir", configDir.toString(), "--no-timestamps");

            assertThat(exitCode).isZero();
            assertThat(io.out()).contains("Creation order: customers, orders").contains("Generated 8 scripts for 2 tables");
            assertThat(io.err()).doesNotContain("foreign key");
        }

        Path database = outputDir.resolve("shop/database");
        assertThat(database.resolve("tables/001_CUSTOMERS.sql")).exists();
        assertThat(database.resolve("tables/002_ORDERS.sql")).exists();
        assertThat(database.resolve("views/001_customers_v.sql")).exists();
        assertThat(database.resolve("data/002_orders_data.sql")).exists();
        assertThat(database.resolve("packages/001_p_customers.sql")).exists();
        assertThat(Files.readString(database.resolve("tables/001_CUSTOMERS.sql")))
                .contains("-- Generated:   [timestamp]")
                .contains("-- Author:      Ada Lovelace");
    }

    @Test
    @DisplayName("Foreign keys read from the definition file reach the generated scripts")
    void foreignKeysFromDefinition() throws Exception {
        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", resource("shop.json").toString(),
                    "--out", outputDir.toString(), "--config-dir", configDir.toString(), "--no-timestamps");

            assertThat(exitCode).as(io.err()).isZero();
        }

        Path database = outputDir.resolve("shop/database");
        assertThat(Files.readString(database.resolve("tables/002_ORDERS.sql")))
                .contains("ADD CONSTRAINT ORDERS_CUSTOMERS_FK")
                .contains("FOREIGN KEY (CUSTOMER_ID)")
                .contains("REFERENCES CUSTOMERS (ID);");
        assertThat(Files.readString(database.resolve("packages/002_p_orders.sql")))
                .contains("LEFT JOIN CUSTOMERS");
    }

    @Test
    @DisplayName("Command line options override the definition and the configuration")
    void optionsOverride() throws Exception {
        Files.writeString(configDir.resolve("tablesmith.yaml"), """
                profiles:
                  ci:
                    format:
                      indentSize: 2
                    metadata:
                      author: Config Author
                """);

        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", resource("shop.json").toString(),
                    "--out", outputDir.toString(), "--config-dir", configDir.toString(),
                    "--profile", "ci", "--author", "Grace Hopper", "--project-folder", "custom");

            assertThat(exitCode).as(io.err()).isZero();
        }

        String table = Files.readString(outputDir.resolve("custom/database/tables/002_ORDERS.sql"));
        assertThat(table).contains("-- Author:      Grace Hopper")
                .contains("\n  ADD CONSTRAINT ORDERS_PK\n");
    }

    @Test
    @DisplayName("An invalid definition is rejected before anything is written")
    void invalidDefinition() throws Exception {
        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", resource("invalid.json").toString(),
                    "--out", outputDir.toString(), "--config-dir", configDir.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(io.err()).contains("Error: Duplicate table name: ITEMS")
                    .contains("Error: Field items.label has no type")
                    .contains("Generation failed: definition has 2 error(s)");
        }
        assertThat(outputDir).doesNotExist();
    }

    @Test
    @DisplayName("A missing definition file fails with exit code 1")
    void missingFile() {
        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", tempDir.resolve("nope.json").toString(), "--config-dir", configDir.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(io.err()).contains("Generation failed: Definition file not found");
        }
    }

    @Test
    @DisplayName("A configured name length below the minimum fails the run")
    void nameLengthTooSmall() throws Exception {
        Files.writeString(configDir.resolve("tablesmith.yaml"), """
                profiles:
                  dev:
                    naming:
                      maxLength: 5
                """);

        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = execute("-d", resource("shop.json").toString(),
                    "--out", outputDir.toString(), "--config-dir", configDir.toString(), "--profile", "dev");

            assertThat(exitCode).isEqualTo(1);
            assertThat(io.err()).contains("Generation failed: maxNameLength must be at least 10");
        }
    }
}
