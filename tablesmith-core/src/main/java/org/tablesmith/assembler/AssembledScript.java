package org.tablesmith.assembler;

import java.util.List;

/**
 * A complete script plus the warnings collected from its sections and the structural check.
 */
public record AssembledScript(String content, List<String> warnings) {

    public AssembledScript {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
