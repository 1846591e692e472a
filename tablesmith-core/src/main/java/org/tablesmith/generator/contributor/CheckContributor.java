package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;
import org.tablesmith.model.AllowedValue;

import java.util.List;
import java.util.stream.Collectors;

public record CheckContributor(String table, String name, String column, List<AllowedValue> allowedValues)
        implements DdlContributor {

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        String listed = allowedValues.stream().map(AllowedValue::getText).collect(Collectors.joining(", "));
        sb.append("-- Check Constraint: ").append(dialect.identifier(column)).append('\n')
                .append("-- Allowed values: ").append(listed).append('\n')
                .append(dialect.getCheckConstraintSql(table, name, column, allowedValues))
                .append("\n\n");
    }
}
