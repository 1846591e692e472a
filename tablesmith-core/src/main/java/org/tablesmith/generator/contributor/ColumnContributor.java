package org.tablesmith.generator.contributor;

import org.tablesmith.dialect.Dialect;
import org.tablesmith.model.FieldModel;

import java.util.List;

public record ColumnContributor(List<FieldModel> fields) implements DdlContributor, TableBodyContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        String indent = dialect.getFormat().indent();
        for (FieldModel f : fields) {
            sb.append(indent).append(dialect.getColumnDefinitionSql(f)).append(",\n");
        }
    }
}
