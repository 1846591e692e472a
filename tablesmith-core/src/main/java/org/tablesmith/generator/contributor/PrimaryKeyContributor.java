package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;

import java.util.List;

public record PrimaryKeyContributor(String table, String name, List<String> columns) implements DdlContributor {

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        sb.append("-- Primary Key Constraint\n")
                .append(dialect.getPrimaryKeyConstraintSql(table, name, columns))
                .append("\n\n");
    }
}
