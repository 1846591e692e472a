package org.tablesmith.cli.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tablesmith.model.ArtifactCategory;
import org.tablesmith.model.GenerationResult;
import org.tablesmith.model.ScriptArtifact;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptWriterServiceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Stores artifacts under project/database/category with their order prefix")
    void layout() throws Exception {
        GenerationResult result = GenerationResult.builder()
                .artifacts(List.of(
                        new ScriptArtifact(ArtifactCategory.TABLES, "oracle", "CUSTOMERS", 1, "-- table"),
                        new ScriptArtifact(ArtifactCategory.PACKAGES, "oracle", "p_orders", 12, "-- package")))
                .build();
        ScriptWriterService writer = new ScriptWriterService(tempDir, "shop");

        List<Path> written = writer.write(result);

        assertThat(written).containsExactly(
                tempDir.resolve("shop/database/tables/001_CUSTOMERS.sql"),
                tempDir.resolve("shop/database/packages/012_p_orders.sql"));
        assertThat(Files.readString(written.get(1))).isEqualTo("-- package");
    }

    @Test
    @DisplayName("Existing files are overwritten")
    void overwrites() throws Exception {
        ScriptWriterService writer = new ScriptWriterService(tempDir, "shop");
        writer.write(GenerationResult.builder()
                .artifacts(List.of(new ScriptArtifact(ArtifactCategory.VIEWS, "oracle", "a_v", 1, "old"))).build());

        List<Path> written = writer.write(GenerationResult.builder()
                .artifacts(List.of(new ScriptArtifact(ArtifactCategory.VIEWS, "oracle", "a_v", 1, "new"))).build());

        assertThat(Files.readString(written.get(0))).isEqualTo("new");
    }

    @Test
    void rejectsBlankProjectFolder() {
        assertThatThrownBy(() -> new ScriptWriterService(tempDir, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
