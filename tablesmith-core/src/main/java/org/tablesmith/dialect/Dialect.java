package org.tablesmith.dialect;

import org.tablesmith.model.AllowedValue;
import org.tablesmith.model.DatabaseType;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ScriptFormat;

import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalInt;

/**
 * SQL rendering for one target database. Generators only assemble statements; every
 * piece of dialect syntax comes from here.
 */
public interface Dialect {

    DatabaseType getDatabaseType();

    IdentifierPolicy getIdentifierPolicy();

    ValueTransformer getValueTransformer();

    ScriptFormat getFormat();

    /** Case-normalized identifier with reserved words escaped. */
    String identifier(String raw);

    // Table

    String openCreateTable(String table);

    String closeCreateTable();

    String getColumnDefinitionSql(FieldModel field);

    // Constraints

    String getPrimaryKeyConstraintSql(String table, String name, List<String> columns);

    String getForeignKeyConstraintSql(String table, String name, String column, String referencedTable, String referencedColumn);

    String getUniqueConstraintSql(String table, String name, String column);

    String getCheckConstraintSql(String table, String name, String column, List<AllowedValue> allowedValues);

    // Comments

    String getTableCommentSql(String table, String comment);

    String getColumnCommentSql(String table, String column, String comment);

    // Types

    TypeCategory categorize(String type);

    OptionalInt declaredLength(String type);

    /** Digits allowed left of the decimal point, when the type declares a precision. */
    OptionalInt integerDigits(String type);

    /** Declared scale, 0 for integer types, empty when unconstrained. */
    OptionalInt fractionDigits(String type);

    String temporalLiteral(LocalDateTime value, TypeCategory category);

    String booleanLiteral(boolean value);

    /** Expression rendering a temporal column as readable text. */
    String displayFormatted(String column);
}
