package org.tablesmith.dialect;

import org.tablesmith.model.AllowedValue;
import org.tablesmith.model.DatabaseType;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ScriptFormat;
import org.tablesmith.options.TablesmithOptions;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class OracleDialect extends AbstractDialect {
    private static final Pattern LENGTH = Pattern.compile("^\\s*N?(?:VAR)?CHAR2?\\s*\\(\\s*(\\d+)\\s*(?:BYTE|CHAR)?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRECISION = Pattern.compile("^\\s*(?:NUMBER|NUMERIC|DECIMAL)\\s*\\(\\s*(\\d+)\\s*(?:,\\s*(-?\\d+)\\s*)?\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTEGER_TYPES = Pattern.compile("^\\s*(?:INTEGER|INT|SMALLINT)\\b", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter LITERAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String DISPLAY_MASK = "YYYY-MM-DD HH24:MI:SS";

    public OracleDialect() {
        this(ScriptFormat.defaults(), TablesmithOptions.Naming.MAX_LENGTH_DEFAULT);
    }

    public OracleDialect(ScriptFormat format, int maxNameLength) {
        super(format, maxNameLength);
    }

    // for tests
    public OracleDialect(ScriptFormat format, IdentifierPolicy identifierPolicy, ValueTransformer valueTransformer) {
        super(format, TablesmithOptions.Naming.MAX_LENGTH_DEFAULT);
        this.identifierPolicy = identifierPolicy;
        this.valueTransformer = valueTransformer;
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy(int maxNameLength) {
        return new OracleIdentifierPolicy(maxNameLength);
    }

    @Override
    protected ValueTransformer initializeValueTransformer() {
        return new OracleValueTransformer();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.ORACLE;
    }

    @Override
    public String identifier(String raw) {
        String normalized = identifierPolicy.normalizeCase(raw);
        return identifierPolicy.isKeyword(normalized) ? OracleUtil.escapeKeyword(normalized) : normalized;
    }

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + identifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n);";
    }

    @Override
    public String getColumnDefinitionSql(FieldModel field) {
        StringBuilder sb = new StringBuilder(padRight(identifier(field.getName()), format.getColumnPadWidth()))
                .append(' ')
                .append(field.getType().trim().toUpperCase(Locale.ROOT));
        // Oracle only accepts DEFAULT ahead of inline constraints
        if (field.hasDefault()) {
            sb.append(" DEFAULT ").append(valueTransformer.defaultLiteral(field.getDefaultValue()));
        }
        if (!field.isNullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    @Override
    public String getPrimaryKeyConstraintSql(String table, String name, List<String> columns) {
        String cols = columns.stream().map(this::identifier).collect(Collectors.joining(", "));
        return alterTable(table, name) + indent() + "PRIMARY KEY (" + cols + ");";
    }

    @Override
    public String getForeignKeyConstraintSql(String table, String name, String column, String referencedTable, String referencedColumn) {
        return alterTable(table, name)
                + indent() + "FOREIGN KEY (" + identifier(column) + ")\n"
                + indent() + "REFERENCES " + identifier(referencedTable) + " (" + identifier(referencedColumn) + ");";
    }

    @Override
    public String getUniqueConstraintSql(String table, String name, String column) {
        return alterTable(table, name) + indent() + "UNIQUE (" + identifier(column) + ");";
    }

    @Override
    public String getCheckConstraintSql(String table, String name, String column, List<AllowedValue> allowedValues) {
        String literals = allowedValues.stream()
                .map(valueTransformer::allowedLiteral)
                .collect(Collectors.joining(", "));
        return alterTable(table, name) + indent() + "CHECK (" + identifier(column) + " IN (" + literals + "));";
    }

    private String alterTable(String table, String name) {
        return "ALTER TABLE " + identifier(table) + "\n"
                + indent() + "ADD CONSTRAINT " + name + "\n";
    }

    @Override
    public String getTableCommentSql(String table, String comment) {
        return "COMMENT ON TABLE " + table + " IS " + valueTransformer.quote(comment) + ";";
    }

    @Override
    public String getColumnCommentSql(String table, String column, String comment) {
        return "COMMENT ON COLUMN " + table + "." + column + " IS " + valueTransformer.quote(comment) + ";";
    }

    @Override
    public TypeCategory categorize(String type) {
        if (type == null) return TypeCategory.OTHER;
        String t = type.trim().toUpperCase(Locale.ROOT);
        if (t.startsWith("TIMESTAMP")) return TypeCategory.TIMESTAMP;
        if (t.startsWith("DATE")) return TypeCategory.DATE;
        if (t.startsWith("BOOLEAN") || t.equals("NUMBER(1)") || t.equals("NUMBER(1,0)")) return TypeCategory.BOOLEAN;
        if (t.contains("CLOB") || t.startsWith("LONG")) return TypeCategory.LOB;
        if (t.contains("CHAR") || t.startsWith("TEXT") || t.startsWith("STRING")) return TypeCategory.TEXT;
        if (t.startsWith("NUMBER") || t.startsWith("INT") || t.startsWith("SMALLINT") || t.startsWith("DECIMAL")
                || t.startsWith("NUMERIC") || t.startsWith("FLOAT") || t.startsWith("BINARY_")
                || t.startsWith("REAL") || t.startsWith("DOUBLE")) {
            return TypeCategory.NUMBER;
        }
        return TypeCategory.OTHER;
    }

    @Override
    public OptionalInt declaredLength(String type) {
        if (type == null) return OptionalInt.empty();
        Matcher m = LENGTH.matcher(type);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    @Override
    public OptionalInt integerDigits(String type) {
        if (type == null) return OptionalInt.empty();
        Matcher m = PRECISION.matcher(type);
        if (!m.find()) return OptionalInt.empty();
        int precision = Integer.parseInt(m.group(1));
        int scale = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        return OptionalInt.of(Math.max(0, precision - Math.max(0, scale)));
    }

    @Override
    public OptionalInt fractionDigits(String type) {
        if (type == null) return OptionalInt.empty();
        if (INTEGER_TYPES.matcher(type).find()) return OptionalInt.of(0);
        Matcher m = PRECISION.matcher(type);
        if (!m.find()) return OptionalInt.empty();
        return OptionalInt.of(m.group(2) != null ? Math.max(0, Integer.parseInt(m.group(2))) : 0);
    }

    @Override
    public String temporalLiteral(LocalDateTime value, TypeCategory category) {
        String text = value.format(LITERAL_FORMAT);
        if (category == TypeCategory.TIMESTAMP) {
            return "TO_TIMESTAMP('" + text + "', '" + DISPLAY_MASK + "')";
        }
        return "TO_DATE('" + text + "', '" + DISPLAY_MASK + "')";
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "1" : "0";
    }

    @Override
    public String displayFormatted(String column) {
        return "TO_CHAR(" + column + ", '" + DISPLAY_MASK + "')";
    }
}
