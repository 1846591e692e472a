package org.tablesmith.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tablesmith.options.TablesmithOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              dev:
                naming:
                  maxLength: 25
                format:
                  indentSize: 2
                  includeTimestamps: false
              prod:
                naming:
                  maxLength: 128
                output:
                  directory: out/prod
                metadata:
                  author: Release Bot
                  license: Apache-2.0
            """;

    @Test
    @DisplayName("Returns defaults when no configuration file exists")
    void noFile_returnsDefaults(@TempDir Path tempDir) {
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration(null);

        assertThat(config)
                .containsEntry(TablesmithOptions.Naming.MAX_LENGTH_KEY, "30")
                .containsEntry(TablesmithOptions.Format.INDENT_SIZE_KEY, "4")
                .containsEntry(TablesmithOptions.Format.INCLUDE_TIMESTAMPS_KEY, "true")
                .containsEntry(TablesmithOptions.Output.DIRECTORY_KEY, TablesmithOptions.Output.DIRECTORY_DEFAULT);
    }

    @Test
    @DisplayName("Loads the values of the requested profile")
    void loadsProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("tablesmith.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration("prod");

        assertThat(config)
                .containsEntry(TablesmithOptions.Naming.MAX_LENGTH_KEY, "128")
                .containsEntry(TablesmithOptions.Output.DIRECTORY_KEY, "out/prod")
                .containsEntry(TablesmithOptions.Metadata.AUTHOR_KEY, "Release Bot")
                .containsEntry(TablesmithOptions.Metadata.LICENSE_KEY, "Apache-2.0")
                .containsEntry(TablesmithOptions.Format.INDENT_SIZE_KEY, "4");
    }

    @Test
    @DisplayName("Finds the configuration file in a parent directory")
    void searchesParents(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("tablesmith.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("a/b/c"));
        ConfigurationLoader loader = new ConfigurationLoader(nested, name -> null);

        Map<String, String> config = loader.loadConfiguration(null);

        assertThat(config)
                .containsEntry(TablesmithOptions.Naming.MAX_LENGTH_KEY, "25")
                .containsEntry(TablesmithOptions.Format.INDENT_SIZE_KEY, "2")
                .containsEntry(TablesmithOptions.Format.INCLUDE_TIMESTAMPS_KEY, "false");
    }

    @Test
    @DisplayName("Unknown profile falls back to defaults")
    void unknownProfile(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("tablesmith.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration("staging");

        assertThat(config).containsEntry(TablesmithOptions.Naming.MAX_LENGTH_KEY, "30");
    }

    @Test
    @DisplayName("Malformed YAML falls back to defaults")
    void malformedYaml(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("tablesmith.yaml"), "profiles: [unclosed");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration("dev");

        assertThat(config).containsEntry(TablesmithOptions.Naming.MAX_LENGTH_KEY, "30");
    }

    @Test
    @DisplayName("Profile precedence: CLI, then environment, then dev")
    void profilePrecedence(@TempDir Path tempDir) {
        ConfigurationLoader withEnv = new ConfigurationLoader(tempDir,
                name -> TablesmithOptions.Profile.ENV_VAR.equals(name) ? "prod" : null);
        ConfigurationLoader withoutEnv = new ConfigurationLoader(tempDir, name -> null);

        assertThat(withEnv.resolveActiveProfile("test")).isEqualTo("test");
        assertThat(withEnv.resolveActiveProfile(" ")).isEqualTo("prod");
        assertThat(withoutEnv.resolveActiveProfile(null)).isEqualTo("dev");
    }
}
