package org.tablesmith.cli;

import org.tablesmith.cli.service.DefinitionIoService;
import org.tablesmith.cli.service.DefinitionValidator;
import org.tablesmith.cli.service.ScriptWriterService;
import org.tablesmith.cli.service.ValidationReport;
import org.tablesmith.config.ConfigurationLoader;
import org.tablesmith.generator.GenerationContext;
import org.tablesmith.model.GenerationResult;
import org.tablesmith.model.ProjectDefinition;
import org.tablesmith.model.ProjectMetadata;
import org.tablesmith.model.ScriptFormat;
import org.tablesmith.options.TablesmithOptions;
import org.tablesmith.pipeline.GenerationPipeline;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Generates table, view, seed data and CRUD package scripts for every table of a definition.
 */
@CommandLine.Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Generates database scripts from a project definition."
)
public class GenerateCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-d", "--definition"}, required = true, description = "Project definition JSON file")
    private Path definitionFile;
    @CommandLine.Option(names = "--out", description = "Output root directory (default: " + TablesmithOptions.Output.DIRECTORY_DEFAULT + ")")
    private Path outputDir;
    @CommandLine.Option(names = "--project-folder", description = "Folder below the output root; defaults to the definition's projectFolder or name")
    private String projectFolder;
    @CommandLine.Option(names = "--author", description = "Author printed into script headers")
    private String author;
    @CommandLine.Option(names = "--license", description = "License printed into script headers")
    private String license;
    @CommandLine.Option(names = "--max-length", description = "Maximum length of generated constraint and trigger names")
    private Integer maxLength;
    @CommandLine.Option(names = "--indent", description = "Spaces per indentation level")
    private Integer indentSize;
    @CommandLine.Option(names = "--no-timestamps", description = "Print a placeholder instead of the generation time")
    private boolean noTimestamps;
    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;
    @CommandLine.Option(names = "--config-dir", description = "Directory where the search for " + TablesmithOptions.Profile.CONFIG_FILE + " starts")
    private Path configDir;

    @Override
    public Integer call() {
        try {
            Map<String, String> config = loadConfiguration();

            ProjectDefinition definition = new DefinitionIoService().load(definitionFile);
            ValidationReport report = new DefinitionValidator().validate(definition);
            printWarnings(report.warnings());
            if (!report.isValid()) {
                report.errors().forEach(e -> System.err.println("Error: " + e));
                System.err.println("Generation failed: definition has " + report.errors().size() + " error(s)");
                return 1;
            }

            ScriptFormat format = ScriptFormat.builder()
                    .indentSize(intSetting(indentSize, config, TablesmithOptions.Format.INDENT_SIZE_KEY,
                            TablesmithOptions.Format.INDENT_SIZE_DEFAULT))
                    .includeTimestamps(!noTimestamps && includeTimestamps(config))
                    .build();
            int nameLength = intSetting(maxLength, config, TablesmithOptions.Naming.MAX_LENGTH_KEY,
                    TablesmithOptions.Naming.MAX_LENGTH_DEFAULT);

            GenerationContext context = GenerationContext.create(
                    definition.getDatabase(), resolveMetadata(definition, config), format, nameLength);
            GenerationResult result = new GenerationPipeline(context).run(definition.getDatabase());
            printWarnings(result.getWarnings());

            ScriptWriterService writer = new ScriptWriterService(resolveOutputDir(config), resolveProjectFolder(definition));
            List<Path> files = writer.write(result);

            System.out.println("Creation order: " + String.join(", ", result.getOrderedTables()));
            System.out.println("Generated " + files.size() + " scripts for " + result.getOrderedTables().size()
                    + " tables in " + writer.databaseRoot());
            return 0;
        } catch (Exception e) {
            System.err.println("Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, String> loadConfiguration() {
        ConfigurationLoader loader = configDir != null ? new ConfigurationLoader(configDir) : new ConfigurationLoader();
        return loader.loadConfiguration(profile);
    }

    // CLI value, then configuration, then default
    private int intSetting(Integer cliValue, Map<String, String> config, String key, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        String configured = config.get(key);
        if (configured == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(configured.trim());
        } catch (NumberFormatException e) {
            System.err.println("Warning: Invalid " + key + " in configuration: " + configured
                    + ". Using default: " + defaultValue);
            return defaultValue;
        }
    }

    private boolean includeTimestamps(Map<String, String> config) {
        String configured = config.get(TablesmithOptions.Format.INCLUDE_TIMESTAMPS_KEY);
        return configured == null ? TablesmithOptions.Format.INCLUDE_TIMESTAMPS_DEFAULT : Boolean.parseBoolean(configured.trim());
    }

    // CLI value, then definition, then configuration
    private ProjectMetadata resolveMetadata(ProjectDefinition definition, Map<String, String> config) {
        return ProjectMetadata.of(
                firstNonBlank(author, definition.getAuthor(), config.get(TablesmithOptions.Metadata.AUTHOR_KEY)),
                firstNonBlank(license, definition.getLicense(), config.get(TablesmithOptions.Metadata.LICENSE_KEY)),
                definition.getDescription());
    }

    private Path resolveOutputDir(Map<String, String> config) {
        if (outputDir != null) {
            return outputDir;
        }
        return Path.of(config.getOrDefault(TablesmithOptions.Output.DIRECTORY_KEY, TablesmithOptions.Output.DIRECTORY_DEFAULT));
    }

    private String resolveProjectFolder(ProjectDefinition definition) {
        String folder = firstNonBlank(projectFolder, definition.getProjectFolder(), definition.getName());
        return folder != null ? folder : "project";
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static void printWarnings(List<String> warnings) {
        warnings.forEach(w -> System.err.println("Warning: " + w));
    }
}
