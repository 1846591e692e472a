package org.tablesmith.generator;

import org.tablesmith.dialect.TypeCategory;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only view exposing every column, temporal columns rendered as text.
 */
public class ViewSectionGenerator extends AbstractSectionGenerator {

    public ViewSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        if (table.getFields() == null || table.getFields().isEmpty()) {
            return Optional.empty();
        }
        String view = naming().viewName(table.getName());
        String tableId = id(table.getName());

        List<String> columns = new ArrayList<>();
        List<String> projections = new ArrayList<>();
        List<String> comments = new ArrayList<>();
        for (FieldModel f : table.getFields()) {
            String col = id(f.getName());
            boolean formatted = isFormatted(f);
            columns.add(col);
            projections.add(formatted ? dialect().displayFormatted(col) + " AS " + col : col);
            comments.add(dialect().getColumnCommentSql(view, col, describe(f, col, tableId, formatted)));
        }

        StringBuilder sb = new StringBuilder();
        sb.append("CREATE OR REPLACE VIEW ").append(view).append(" (\n")
                .append(indent(1)).append(String.join(",\n" + indent(1), columns)).append('\n')
                .append(") AS\n")
                .append(indent(1)).append("SELECT ")
                .append(String.join(",\n" + indent(1) + "       ", projections)).append('\n')
                .append(indent(1)).append("  FROM ").append(tableId).append(";\n\n")
                .append(dialect().getTableCommentSql(view,
                        "View for " + tableId + " table with formatted columns for display purposes"))
                .append('\n')
                .append(String.join("\n", comments));
        return section(sb.toString());
    }

    /**
     * Temporal types, and columns named like timestamps unless their type rules that out.
     */
    boolean isFormatted(FieldModel f) {
        TypeCategory category = dialect().categorize(f.getType());
        if (category.isTemporal()) return true;
        String name = f.getName().toLowerCase(Locale.ROOT);
        boolean namedLikeTimestamp = name.endsWith("_on") || name.endsWith("_at");
        // TO_CHAR with a date mask fails on character and numeric columns, so those are projected as is
        return namedLikeTimestamp && category == TypeCategory.OTHER;
    }

    private String describe(FieldModel f, String col, String tableId, boolean formatted) {
        String base = f.hasComment() ? f.getComment().trim() : col + " field from " + tableId + " table";
        return formatted ? base + " (formatted for display)" : base;
    }

    @Override
    public String sectionName() {
        return "TABLE VIEWS";
    }

    @Override
    public String sectionDescription() {
        return "Read-only views with display formatting";
    }
}
