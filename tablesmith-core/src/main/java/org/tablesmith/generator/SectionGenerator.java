package org.tablesmith.generator;

import org.tablesmith.model.TableModel;

import java.util.Optional;

/**
 * Produces one section of a table's scripts. An empty result means the section does not apply to
 * the table, which is not an error.
 */
public interface SectionGenerator {

    Optional<ScriptSection> generate(TableModel table);

    /** Title printed in the section banner. */
    String sectionName();

    /** One line printed under the title. */
    String sectionDescription();
}
