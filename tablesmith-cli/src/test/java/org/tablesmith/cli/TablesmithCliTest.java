package org.tablesmith.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class TablesmithCliTest {

    @Test
    @DisplayName("Help lists the generate and order subcommands")
    void help() {
        StringWriter out = new StringWriter();
        int exitCode = new CommandLine(new TablesmithCli())
                .setOut(new PrintWriter(out))
                .execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("generate").contains("order");
    }

    @Test
    @DisplayName("Version option prints the tool version")
    void version() {
        StringWriter out = new StringWriter();
        int exitCode = new CommandLine(new TablesmithCli())
                .setOut(new PrintWriter(out))
                .execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("tablesmith 0.1.0");
    }

    @Test
    @DisplayName("Generate requires a definition file")
    void missingDefinitionOption() {
        StringWriter err = new StringWriter();
        int exitCode = new CommandLine(new TablesmithCli())
                .setErr(new PrintWriter(err))
                .execute("generate");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--definition");
    }
}
