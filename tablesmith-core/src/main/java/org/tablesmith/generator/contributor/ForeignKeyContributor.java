package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;

public record ForeignKeyContributor(String table, String name, String column,
                                    String referencedTable, String referencedColumn) implements DdlContributor {

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        sb.append("-- Foreign Key Constraint: ")
                .append(dialect.identifier(column)).append(" -> ")
                .append(dialect.identifier(referencedTable)).append('(')
                .append(dialect.identifier(referencedColumn)).append(")\n")
                .append(dialect.getForeignKeyConstraintSql(table, name, column, referencedTable, referencedColumn))
                .append("\n\n");
    }
}
