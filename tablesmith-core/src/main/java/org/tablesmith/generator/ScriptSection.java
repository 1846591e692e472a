package org.tablesmith.generator;

import java.util.List;

/**
 * One titled block of a script.
 *
 * @param warnings problems found while building the block; the block is still usable
 */
public record ScriptSection(String name, String description, String body, List<String> warnings) {

    public ScriptSection {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ScriptSection(String name, String description, String body) {
        this(name, description, body, List.of());
    }
}
