package org.tablesmith.cli;

import org.tablesmith.cli.service.DefinitionIoService;
import org.tablesmith.model.ProjectDefinition;
import org.tablesmith.resolver.DependencyResolver;
import org.tablesmith.resolver.Resolution;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the table creation order without generating anything.
 */
@CommandLine.Command(
        name = "order",
        mixinStandardHelpOptions = true,
        description = "Prints the order in which tables must be created."
)
public class OrderCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-d", "--definition"}, required = true, description = "Project definition JSON file")
    private Path definitionFile;

    @Override
    public Integer call() {
        try {
            ProjectDefinition definition = new DefinitionIoService().load(definitionFile);
            Resolution resolution = new DependencyResolver().resolve(definition.getDatabase().getTables());

            resolution.warnings().forEach(w -> System.err.println("Warning: " + w));
            List<String> names = resolution.tableNames();
            for (int i = 0; i < names.size(); i++) {
                System.out.printf("%3d. %s%n", i + 1, names.get(i));
            }
            System.out.println();
            System.out.println(resolution.explanation());
            return 0;
        } catch (Exception e) {
            System.err.println("Order failed: " + e.getMessage());
            return 1;
        }
    }
}
