package org.tablesmith.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OrderCommandTest {

    @Test
    @DisplayName("Prints the numbered creation order and the explanation")
    void printsOrder() throws Exception {
        Path definition = Path.of(getClass().getResource("/definitions/shop.json").toURI());

        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = new CommandLine(new OrderCommand()).execute("-d", definition.toString());

            assertThat(exitCode).isZero();
            assertThat(io.out()).contains("  1. customers\n  2. orders\n")
                    .contains("Tables sorted by dependencies: customers → orders");
            assertThat(io.err()).isEmpty();
        }
    }

    @Test
    @DisplayName("Cycles are reported as warnings")
    void cycle(@TempDir Path tempDir) throws Exception {
        Path definition = tempDir.resolve("cycle.json");
        Files.writeString(definition, """
                {"database": {"tables": [
                  {"name": "a", "referencingTo": ["b"], "fields": [{"name": "id", "type": "NUMBER"}]},
                  {"name": "b", "referencingTo": ["a"], "fields": [{"name": "id", "type": "NUMBER"}]}
                ]}}
                """);

        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = new CommandLine(new OrderCommand()).execute("-d", definition.toString());

            assertThat(exitCode).isZero();
            assertThat(io.err()).contains("Warning: Circular dependency detected involving table: a");
        }
    }

    @Test
    void emptySchemaFails(@TempDir Path tempDir) throws Exception {
        Path definition = tempDir.resolve("empty.json");
        Files.writeString(definition, "{\"database\": {\"tables\": []}}");

        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = new CommandLine(new OrderCommand()).execute("-d", definition.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(io.err()).contains("Order failed: Schema must contain at least one table");
        }
    }
}
