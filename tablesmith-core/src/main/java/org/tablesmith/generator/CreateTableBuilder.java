package org.tablesmith.generator;

import org.tablesmith.dialect.Dialect;
import org.tablesmith.generator.contributor.ColumnContributor;
import org.tablesmith.generator.contributor.DdlContributor;
import org.tablesmith.generator.contributor.TableBodyContributor;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final String table;
    private final Dialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();

    public CreateTableBuilder(String table, Dialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (!(c instanceof TableBodyContributor)) {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        body.add(c);
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable());
        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }

    public CreateTableBuilder defaultsFrom(TableModel model) {
        return add(new ColumnContributor(model.getFields()));
    }
}
