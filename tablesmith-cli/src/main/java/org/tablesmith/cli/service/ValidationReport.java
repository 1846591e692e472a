package org.tablesmith.cli.service;

import java.util.List;

/**
 * Outcome of {@link DefinitionValidator}. Errors block generation, warnings do not.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
