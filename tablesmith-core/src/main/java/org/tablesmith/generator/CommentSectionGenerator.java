package org.tablesmith.generator;

import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;

import java.util.Optional;
import java.util.stream.Collectors;

public class CommentSectionGenerator extends AbstractSectionGenerator {

    public CommentSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        String tableId = id(table.getName());
        String body = table.getFields().stream()
                .filter(FieldModel::hasComment)
                .map(f -> dialect().getColumnCommentSql(tableId, id(f.getName()), f.getComment().trim()))
                .collect(Collectors.joining("\n"));
        return body.isEmpty() ? Optional.empty() : section(body);
    }

    @Override
    public String sectionName() {
        return "DOCUMENTATION & COMMENTS";
    }

    @Override
    public String sectionDescription() {
        return "Field descriptions and documentation";
    }
}
