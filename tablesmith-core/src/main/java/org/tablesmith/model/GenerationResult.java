package org.tablesmith.model;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Builder
@Getter
public class GenerationResult {
    @Builder.Default private List<String> orderedTables = new ArrayList<>();
    @Builder.Default private List<ScriptArtifact> artifacts = new ArrayList<>();
    @Builder.Default private List<String> warnings = new ArrayList<>();
    @Builder.Default private String explanation = "";

    public List<ScriptArtifact> artifactsOf(ArtifactCategory category) {
        return artifacts.stream().filter(a -> a.category() == category).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
