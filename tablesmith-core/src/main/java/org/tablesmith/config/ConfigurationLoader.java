package org.tablesmith.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.tablesmith.options.TablesmithOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = TablesmithOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = TablesmithOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = TablesmithOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration and applies the selected profile.
     *
     * Precedence: CLI profile > environment variable > default (dev)
     *
     * @param cliProfile profile given on the command line, may be null
     * @return resolved key/value settings
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<TablesmithConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the file system root looking for tablesmith.yaml.
     */
    private Optional<TablesmithConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    TablesmithConfiguration config = yamlMapper.readValue(configFile.toFile(), TablesmithConfiguration.class);
                    return Optional.of(config);
                } catch (IOException e) {
                    System.err.println("Warning: Failed to parse " + configFile + ": " + e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(TablesmithConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            System.err.println("Warning: Profile '" + profile + "' not found in configuration. Using defaults.");
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getNaming() != null && profileConfig.getNaming().getMaxLength() != null) {
            configMap.put(TablesmithOptions.Naming.MAX_LENGTH_KEY,
                    String.valueOf(profileConfig.getNaming().getMaxLength()));
        }

        var format = profileConfig.getFormat();
        if (format != null) {
            if (format.getIndentSize() != null) {
                configMap.put(TablesmithOptions.Format.INDENT_SIZE_KEY, String.valueOf(format.getIndentSize()));
            }
            if (format.getIncludeTimestamps() != null) {
                configMap.put(TablesmithOptions.Format.INCLUDE_TIMESTAMPS_KEY,
                        String.valueOf(format.getIncludeTimestamps()));
            }
        }

        if (profileConfig.getOutput() != null && profileConfig.getOutput().getDirectory() != null) {
            configMap.put(TablesmithOptions.Output.DIRECTORY_KEY, profileConfig.getOutput().getDirectory());
        }

        var metadata = profileConfig.getMetadata();
        if (metadata != null) {
            if (metadata.getAuthor() != null) {
                configMap.put(TablesmithOptions.Metadata.AUTHOR_KEY, metadata.getAuthor());
            }
            if (metadata.getLicense() != null) {
                configMap.put(TablesmithOptions.Metadata.LICENSE_KEY, metadata.getLicense());
            }
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                TablesmithOptions.Naming.MAX_LENGTH_KEY, String.valueOf(TablesmithOptions.Naming.MAX_LENGTH_DEFAULT),
                TablesmithOptions.Format.INDENT_SIZE_KEY, String.valueOf(TablesmithOptions.Format.INDENT_SIZE_DEFAULT),
                TablesmithOptions.Format.INCLUDE_TIMESTAMPS_KEY, String.valueOf(TablesmithOptions.Format.INCLUDE_TIMESTAMPS_DEFAULT),
                TablesmithOptions.Output.DIRECTORY_KEY, TablesmithOptions.Output.DIRECTORY_DEFAULT
        );
    }
}
