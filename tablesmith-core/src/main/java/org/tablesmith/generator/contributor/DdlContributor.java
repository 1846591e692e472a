package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;

public interface DdlContributor extends SqlContributor {
    void contribute(StringBuilder sb, Dialect dialect);
}
