package org.tablesmith.generator;

import lombok.Getter;
import org.tablesmith.dialect.Dialect;
import org.tablesmith.generator.contributor.DdlContributor;
import org.tablesmith.generator.contributor.SqlContributor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects ALTER TABLE statements issued after the table exists. Contributors with equal priority
 * keep their insertion order.
 */
public class AlterTableBuilder {
    @Getter
    private final String tableName;
    @Getter
    private final Dialect dialect;
    @Getter
    private final List<DdlContributor> units = new ArrayList<>();

    public AlterTableBuilder(String tableName, Dialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public AlterTableBuilder add(DdlContributor unit) {
        units.add(unit);
        return this;
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public String build() {
        StringBuilder sb = new StringBuilder();
        units.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));
        return sb.toString().trim();
    }
}
