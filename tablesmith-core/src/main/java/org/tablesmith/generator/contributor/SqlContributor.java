package org.tablesmith.generator.contributor;

public interface SqlContributor {
    default int priority() {
        return 0;
    }
}
