package org.tablesmith.generator;

import lombok.Builder;
import lombok.Getter;
import org.tablesmith.dialect.Dialect;
import org.tablesmith.dialect.OracleDialect;
import org.tablesmith.model.DatabaseType;
import org.tablesmith.model.ProjectMetadata;
import org.tablesmith.model.SchemaModel;
import org.tablesmith.model.ScriptFormat;
import org.tablesmith.model.TableModel;
import org.tablesmith.naming.Naming;
import org.tablesmith.naming.OracleNaming;

import java.util.Optional;

/**
 * Everything a generator needs besides the table itself. Fixed for the whole run.
 */
@Getter
@Builder
public class GenerationContext {
    private final Dialect dialect;
    private final Naming naming;
    private final SchemaModel schema;
    @Builder.Default private final ProjectMetadata metadata = ProjectMetadata.defaults();

    public ScriptFormat getFormat() {
        return dialect.getFormat();
    }

    public Optional<TableModel> findTable(String name) {
        return schema == null ? Optional.empty() : schema.findTable(name);
    }

    public static GenerationContext create(SchemaModel schema, ProjectMetadata metadata, ScriptFormat format, int maxNameLength) {
        DatabaseType type = schema.getType() != null ? schema.getType() : DatabaseType.ORACLE;
        return switch (type) {
            case ORACLE -> GenerationContext.builder()
                    .dialect(new OracleDialect(format, maxNameLength))
                    .naming(new OracleNaming(maxNameLength))
                    .schema(schema)
                    .metadata(metadata != null ? metadata : ProjectMetadata.defaults())
                    .build();
        };
    }
}
