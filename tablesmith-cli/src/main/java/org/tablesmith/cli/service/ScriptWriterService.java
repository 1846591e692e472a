package org.tablesmith.cli.service;

import org.tablesmith.model.GenerationResult;
import org.tablesmith.model.ScriptArtifact;
import org.tablesmith.options.TablesmithOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists generated artifacts as {@code <out>/<projectFolder>/database/<category>/NNN_<name>.sql}.
 * Existing files with the same name are overwritten.
 */
public class ScriptWriterService {

    private final Path outputDir;
    private final String projectFolder;

    public ScriptWriterService(Path outputDir, String projectFolder) {
        if (projectFolder == null || projectFolder.isBlank()) {
            throw new IllegalArgumentException("Project folder must not be blank");
        }
        this.outputDir = outputDir;
        this.projectFolder = projectFolder.trim();
    }

    public Path databaseRoot() {
        return outputDir.resolve(projectFolder).resolve(TablesmithOptions.Output.DATABASE_FOLDER);
    }

    /**
     * @return written files in artifact order
     */
    public List<Path> write(GenerationResult result) throws IOException {
        List<Path> written = new ArrayList<>();
        for (ScriptArtifact artifact : result.getArtifacts()) {
            Path dir = databaseRoot().resolve(artifact.category().getFolder());
            Files.createDirectories(dir);
            Path file = dir.resolve(artifact.orderedFileName());
            Files.writeString(file, artifact.content(), StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }
}
