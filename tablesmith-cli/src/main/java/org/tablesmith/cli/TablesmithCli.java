package org.tablesmith.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point. Turns a project definition into Oracle DDL, seed data and CRUD packages.
 */
@CommandLine.Command(
        name = "tablesmith",
        mixinStandardHelpOptions = true,
        version = "tablesmith 0.1.0",
        description = "Generates Oracle database scripts from a JSON project definition",
        subcommands = {
                GenerateCommand.class,
                OrderCommand.class
        }
)
public class TablesmithCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TablesmithCli()).execute(args);
        System.exit(exitCode);
    }
}
