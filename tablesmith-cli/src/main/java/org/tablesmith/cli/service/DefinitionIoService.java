package org.tablesmith.cli.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.tablesmith.model.ProjectDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads project definition files.
 */
public class DefinitionIoService {
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads a project definition from a JSON file.
     *
     * @param path definition file
     * @return the parsed definition, never null
     * @throws IOException if the file is missing or not valid JSON
     * @throws IllegalArgumentException if the definition has no database block
     */
    public ProjectDefinition load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("Definition file not found: " + path);
        }
        ProjectDefinition definition = objectMapper.readValue(path.toFile(), ProjectDefinition.class);
        if (definition == null || definition.getDatabase() == null) {
            throw new IllegalArgumentException("Definition " + path + " has no database section");
        }
        return definition;
    }
}
