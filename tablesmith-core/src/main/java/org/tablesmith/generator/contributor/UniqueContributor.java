package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;

public record UniqueContributor(String table, String name, String column) implements DdlContributor {

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        sb.append("-- Unique Constraint: ").append(dialect.identifier(column)).append('\n')
                .append(dialect.getUniqueConstraintSql(table, name, column))
                .append("\n\n");
    }
}
