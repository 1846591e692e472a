package org.tablesmith.generator;

import org.tablesmith.dialect.TypeCategory;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ForeignKeyRef;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * PL/SQL access package ({@code pkg_<table>}) with create, update, delete, single-record and paged
 * list functions. Every function answers with a JSON envelope in a CLOB.
 *
 * <p>Error codes raised by the generated code:
 * <ul>
 *   <li>-20001 validation failure (missing required value, value too long)</li>
 *   <li>-20002 record not found</li>
 *   <li>-20003 referenced parent row does not exist</li>
 *   <li>-20010 sort column not in the table's column list</li>
 * </ul>
 */
public class CrudPackageSectionGenerator extends AbstractSectionGenerator {
    public static final int ERR_VALIDATION = -20001;
    public static final int ERR_NOT_FOUND = -20002;
    public static final int ERR_MISSING_REFERENCE = -20003;
    public static final int ERR_INVALID_SORT = -20010;

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;
    private static final String JSON_TIMESTAMP_MASK = "'YYYY-MM-DD\"T\"HH24:MI:SS'";

    public CrudPackageSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        if (!table.hasPrimaryKey()) {
            return Optional.empty();
        }
        Model m = new Model(table);
        String body = specification(m) + "\n/\n\n" + packageBody(m) + "\n/";
        return section(body, m.warnings);
    }

    // Specification

    private String specification(Model m) {
        Lines l = new Lines();
        l.add(0, "CREATE OR REPLACE PACKAGE " + m.packageName + " AS");
        l.blank();
        l.add(1, "-- Create a new record");
        l.add(1, "FUNCTION create_record" + parameterList(m, m.createParams, ParameterDefaults.COLUMN_DEFAULTS) + " RETURN CLOB;");
        l.blank();
        l.add(1, "-- Update an existing record");
        l.add(1, "FUNCTION update_record" + parameterList(m, m.updateParams, ParameterDefaults.NULLS) + " RETURN CLOB;");
        l.blank();
        l.add(1, "-- Delete a record");
        l.add(1, "FUNCTION delete_record" + parameterList(m, m.pk, ParameterDefaults.NONE) + " RETURN CLOB;");
        l.blank();
        l.add(1, "-- Get a single record");
        l.add(1, "FUNCTION get_record" + parameterList(m, m.pk, ParameterDefaults.NONE) + " RETURN CLOB;");
        l.blank();
        l.add(1, "-- Get multiple records with pagination, sorting, and filtering");
        l.add(1, "FUNCTION get_records" + pagingParameters(m) + " RETURN CLOB;");
        l.blank();
        l.add(0, "END " + m.packageName + ";");
        return l.toString();
    }

    // Body

    private String packageBody(Model m) {
        Lines l = new Lines();
        l.add(0, "CREATE OR REPLACE PACKAGE BODY " + m.packageName + " AS");
        l.blank();
        l.add(1, "-- Valid sortable columns for records");
        l.add(1, "c_valid_sort_columns CONSTANT VARCHAR2(4000) := '," + m.allFields.stream().map(this::key).collect(Collectors.joining(",")) + ",';");
        if (!m.searchable.isEmpty()) {
            l.add(1, "-- Searchable fields for records");
            l.add(1, "c_searchable_fields  CONSTANT VARCHAR2(4000) := '" + m.searchable.stream().map(this::key).collect(Collectors.joining(",")) + "';");
        }
        l.add(1, "c_max_page_size      CONSTANT PLS_INTEGER := " + MAX_PAGE_SIZE + ";");
        l.blank();
        buildResponse(l);
        l.blank();
        handleAllExceptions(l);
        l.blank();
        validateData(l, m);
        l.blank();
        recordObject(l, m);
        l.blank();
        createRecord(l, m);
        l.blank();
        updateRecord(l, m);
        l.blank();
        deleteRecord(l, m);
        l.blank();
        getRecord(l, m);
        l.blank();
        getRecords(l, m);
        l.blank();
        l.add(0, "END " + m.packageName + ";");
        return l.toString();
    }

    private void buildResponse(Lines l) {
        l.add(1, "/**");
        l.add(1, " * Wraps a payload into the standard response envelope");
        l.add(1, " */");
        l.add(1, "FUNCTION build_response (");
        l.add(2, "p_status      IN VARCHAR2,");
        l.add(2, "p_message     IN VARCHAR2,");
        l.add(2, "p_data        IN JSON_ELEMENT_T DEFAULT NULL,");
        l.add(2, "p_http_status IN NUMBER DEFAULT 200");
        l.add(1, ") RETURN CLOB IS");
        l.add(2, "l_response JSON_OBJECT_T := JSON_OBJECT_T();");
        l.add(1, "BEGIN");
        l.add(2, "l_response.put('status', p_status);");
        l.add(2, "l_response.put('http_status', p_http_status);");
        l.add(2, "l_response.put('message', p_message);");
        l.add(2, "IF p_data IS NOT NULL THEN");
        l.add(3, "l_response.put('data', p_data);");
        l.add(2, "END IF;");
        l.add(2, "RETURN l_response.to_clob();");
        l.add(1, "END build_response;");
    }

    private void handleAllExceptions(Lines l) {
        l.add(1, "/**");
        l.add(1, " * Maps an error to the response envelope and an HTTP-like status");
        l.add(1, " */");
        l.add(1, "FUNCTION handle_all_exceptions (");
        l.add(2, "p_code    IN NUMBER,");
        l.add(2, "p_message IN VARCHAR2");
        l.add(1, ") RETURN CLOB IS");
        l.add(1, "BEGIN");
        l.add(2, "CASE p_code");
        caseBranch(l, "-1", "'Record already exists'", 409);
        caseBranch(l, String.valueOf(ERR_VALIDATION), "p_message", 400);
        caseBranch(l, String.valueOf(ERR_NOT_FOUND), "'Record not found'", 404);
        caseBranch(l, String.valueOf(ERR_MISSING_REFERENCE), "p_message", 422);
        caseBranch(l, "-2291", "'Referenced record not found'", 422);
        caseBranch(l, String.valueOf(ERR_INVALID_SORT), "p_message", 400);
        l.add(3, "ELSE");
        l.add(4, "RETURN build_response('error', 'Record operation failed: ' || p_message, NULL, 500);");
        l.add(2, "END CASE;");
        l.add(1, "END handle_all_exceptions;");
    }

    private void caseBranch(Lines l, String code, String message, int status) {
        l.add(3, "WHEN " + code + " THEN");
        l.add(4, "RETURN build_response('error', " + message + ", NULL, " + status + ");");
    }

    private void validateData(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Validates data before create or update operations");
        l.add(1, " */");
        l.add(1, "PROCEDURE validate_data" + parameterList(m, m.inputs, ParameterDefaults.NONE) + " IS");
        l.add(2, "l_count NUMBER;");
        l.add(1, "BEGIN");
        boolean any = false;
        for (FieldModel f : m.inputs) {
            String p = param(f);
            if (!f.isNullable()) {
                any = true;
                l.add(2, "IF " + p + " IS NULL THEN");
                l.add(3, "RAISE_APPLICATION_ERROR(" + ERR_VALIDATION + ", '" + key(f) + " is required');");
                l.add(2, "END IF;");
            }
            OptionalInt max = dialect().declaredLength(f.getType());
            if (max.isPresent()) {
                any = true;
                l.add(2, "IF " + p + " IS NOT NULL AND LENGTH(" + p + ") > " + max.getAsInt() + " THEN");
                l.add(3, "RAISE_APPLICATION_ERROR(" + ERR_VALIDATION + ", '" + key(f)
                        + " exceeds maximum length of " + max.getAsInt() + "');");
                l.add(2, "END IF;");
            }
        }
        for (Join j : m.joins) {
            if (!m.inputs.contains(j.field)) continue;
            any = true;
            String p = param(j.field);
            l.add(2, "IF " + p + " IS NOT NULL THEN");
            l.add(3, "SELECT COUNT(*)");
            l.add(3, "  INTO l_count");
            l.add(3, "  FROM " + j.targetTable);
            l.add(3, " WHERE " + j.targetColumn + " = " + p + ";");
            l.add(3, "IF l_count = 0 THEN");
            l.add(4, "RAISE_APPLICATION_ERROR(" + ERR_MISSING_REFERENCE + ", 'Referenced " + j.targetTable
                    + " record not found for " + key(j.field) + "');");
            l.add(3, "END IF;");
            l.add(2, "END IF;");
        }
        if (!any) {
            l.add(2, "NULL;");
        }
        l.add(1, "END validate_data;");
    }

    private void recordObject(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Creates a JSON object for a single record, including referenced display columns");
        l.add(1, " */");
        l.add(1, "FUNCTION get_record_object" + parameterList(m, m.pk, ParameterDefaults.NONE) + " RETURN JSON_OBJECT_T IS");
        l.add(2, "l_json JSON_OBJECT_T := JSON_OBJECT_T();");
        l.add(1, "BEGIN");
        l.add(2, "FOR r IN (");

        List<String> select = new ArrayList<>();
        for (FieldModel f : m.allFields) {
            select.add("t." + col(f));
        }
        for (Join j : m.joins) {
            for (FieldModel d : j.displayFields) {
                select.add(j.alias + "." + col(d) + " AS " + j.projectedName(d));
            }
        }
        l.add(3, "SELECT " + String.join(",\n" + indent(3) + "       ", select));
        l.add(3, "  FROM " + m.tableId + " t");
        for (Join j : m.joins) {
            l.add(3, "  LEFT JOIN " + j.targetTable + " " + j.alias + " ON " + j.alias + "." + j.targetColumn
                    + " = t." + col(j.field));
        }
        l.add(3, " WHERE " + pkPredicate(m, "t.", "p_"));
        l.add(2, ") LOOP");
        for (FieldModel f : m.allFields) {
            l.add(3, "l_json.put('" + key(f) + "', " + jsonValue(f, "r." + col(f)) + ");");
        }
        for (Join j : m.joins) {
            for (FieldModel d : j.displayFields) {
                String projected = j.projectedName(d);
                l.add(3, "l_json.put('" + projected.toLowerCase(Locale.ROOT) + "', " + jsonValue(d, "r." + projected) + ");");
            }
        }
        l.add(3, "RETURN l_json;");
        l.add(2, "END LOOP;");
        l.add(2, "RAISE_APPLICATION_ERROR(" + ERR_NOT_FOUND + ", 'Record not found');");
        l.add(1, "END get_record_object;");
    }

    private void createRecord(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Creates a new record");
        l.add(1, " */");
        l.add(1, "FUNCTION create_record" + parameterList(m, m.createParams, ParameterDefaults.COLUMN_DEFAULTS) + " RETURN CLOB IS");
        for (FieldModel f : m.pk) {
            l.add(2, local(f) + " " + anchored(m, f) + ";");
        }
        l.add(1, "BEGIN");
        validateCall(l, m);
        if (m.generatedKey) {
            FieldModel key = m.pk.get(0);
            l.add(2, "SELECT NVL(MAX(" + col(key) + "), 0) + 1");
            l.add(2, "  INTO " + local(key));
            l.add(2, "  FROM " + m.tableId + ";");
        } else {
            for (FieldModel f : m.pk) {
                l.add(2, local(f) + " := " + param(f) + ";");
            }
        }
        l.blank();

        List<String> columns = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (FieldModel f : m.pk) {
            columns.add(col(f));
            values.add(local(f));
        }
        for (FieldModel f : m.inputs) {
            columns.add(col(f));
            values.add(param(f));
        }
        for (FieldModel f : m.allFields) {
            FieldRoles.createStamp(f, dialect()).ifPresent(stamp -> {
                columns.add(col(f));
                values.add(stamp);
            });
        }
        l.add(2, "INSERT INTO " + m.tableId + " (");
        l.add(3, String.join(",\n" + indent(3), columns));
        l.add(2, ") VALUES (");
        l.add(3, String.join(",\n" + indent(3), values));
        l.add(2, ");");
        l.blank();
        l.add(2, "RETURN build_response('success', 'Record created successfully', get_record_object("
                + m.pk.stream().map(this::local).collect(Collectors.joining(", ")) + "), 201);");
        exceptionBlock(l, false);
        l.add(1, "END create_record;");
    }

    private void updateRecord(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Updates an existing record");
        l.add(1, " */");
        l.add(1, "FUNCTION update_record" + parameterList(m, m.updateParams, ParameterDefaults.NULLS) + " RETURN CLOB IS");
        l.add(2, "l_count NUMBER;");
        l.add(1, "BEGIN");
        validateCall(l, m);
        existenceCheck(l, m);

        List<String> sets = new ArrayList<>();
        for (FieldModel f : m.inputs) {
            sets.add(col(f) + " = " + param(f));
        }
        for (FieldModel f : m.allFields) {
            FieldRoles.updateStamp(f, dialect()).ifPresent(stamp -> sets.add(col(f) + " = " + stamp));
        }
        if (sets.isEmpty()) {
            l.add(2, "-- no updatable columns");
        } else {
            l.add(2, "UPDATE " + m.tableId);
            l.add(2, "   SET " + String.join(",\n" + indent(2) + "       ", sets));
            l.add(2, " WHERE " + pkPredicate(m, "", "p_") + ";");
        }
        l.blank();
        l.add(2, "RETURN build_response('success', 'Record updated successfully', get_record_object("
                + pkArguments(m, "p_") + "), 200);");
        exceptionBlock(l, false);
        l.add(1, "END update_record;");
    }

    private void deleteRecord(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Deletes a record");
        l.add(1, " */");
        l.add(1, "FUNCTION delete_record" + parameterList(m, m.pk, ParameterDefaults.NONE) + " RETURN CLOB IS");
        l.add(2, "l_count    NUMBER;");
        l.add(2, "l_response JSON_OBJECT_T := JSON_OBJECT_T();");
        l.add(1, "BEGIN");
        existenceCheck(l, m);
        l.add(2, "DELETE FROM " + m.tableId);
        l.add(2, " WHERE " + pkPredicate(m, "", "p_") + ";");
        l.blank();
        for (FieldModel f : m.pk) {
            String jsonKey = m.pk.size() == 1 ? "deleted_id" : "deleted_" + key(f);
            l.add(2, "l_response.put('" + jsonKey + "', " + param(f) + ");");
        }
        l.add(2, "RETURN build_response('success', 'Record deleted successfully', l_response, 200);");
        exceptionBlock(l, false);
        l.add(1, "END delete_record;");
    }

    private void getRecord(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Retrieves a single record");
        l.add(1, " */");
        l.add(1, "FUNCTION get_record" + parameterList(m, m.pk, ParameterDefaults.NONE) + " RETURN CLOB IS");
        l.add(1, "BEGIN");
        l.add(2, "RETURN build_response('success', 'Record retrieved successfully', get_record_object("
                + pkArguments(m, "p_") + "), 200);");
        exceptionBlock(l, false);
        l.add(1, "END get_record;");
    }

    private void getRecords(Lines l, Model m) {
        l.add(1, "/**");
        l.add(1, " * Retrieves multiple records with pagination, sorting, and filtering");
        l.add(1, " */");
        l.add(1, "FUNCTION get_records" + pagingParameters(m) + " RETURN CLOB IS");
        l.add(2, "v_page         PLS_INTEGER := GREATEST(NVL(TRUNC(p_page), 1), 1);");
        l.add(2, "v_page_size    PLS_INTEGER := LEAST(GREATEST(NVL(TRUNC(p_page_size), " + DEFAULT_PAGE_SIZE + "), 1), c_max_page_size);");
        l.add(2, "v_offset       PLS_INTEGER;");
        l.add(2, "v_sort_by      VARCHAR2(128) := LOWER(TRIM(NVL(p_sort_by, '" + key(m.pk.get(0)) + "')));");
        l.add(2, "v_sort_order   VARCHAR2(4) := CASE WHEN UPPER(TRIM(p_sort_order)) = 'DESC' THEN 'DESC' ELSE 'ASC' END;");
        l.add(2, "v_query        VARCHAR2(4000) := TRIM(p_query);");
        l.add(2, "v_where_clause VARCHAR2(4000) := ' WHERE 1 = 1';");
        l.add(2, "v_sql          VARCHAR2(4000);");
        l.add(2, "v_total_count  NUMBER;");
        l.add(2, "v_total_pages  NUMBER;");
        l.add(2, "v_data         JSON_ARRAY_T := JSON_ARRAY_T();");
        l.add(2, "v_result       JSON_OBJECT_T := JSON_OBJECT_T();");
        for (FieldModel f : m.pk) {
            l.add(2, "v_" + key(f) + " " + anchored(m, f) + ";");
        }
        l.add(2, "c_records      SYS_REFCURSOR;");
        l.add(1, "BEGIN");
        l.add(2, "IF INSTR(c_valid_sort_columns, ',' || v_sort_by || ',') = 0 THEN");
        l.add(3, "RAISE_APPLICATION_ERROR(" + ERR_INVALID_SORT + ", 'Invalid sort column: ' || p_sort_by);");
        l.add(2, "END IF;");
        l.add(2, "v_offset := (v_page - 1) * v_page_size;");
        l.blank();

        boolean searchable = !m.searchable.isEmpty();
        String using = "";
        if (searchable) {
            List<String> exact = new ArrayList<>();
            List<String> partial = new ArrayList<>();
            List<String> binds = new ArrayList<>();
            int i = 1;
            for (FieldModel f : m.searchable) {
                String expr = searchExpression(f);
                exact.add(expr + " = UPPER(:q" + i + ")");
                partial.add(expr + " LIKE ''%'' || UPPER(:q" + i + ") || ''%''");
                binds.add("v_query");
                i++;
            }
            using = " USING " + String.join(", ", binds);
            l.add(2, "-- one shared filter keeps the count and the page consistent");
            l.add(2, "IF v_query IS NOT NULL THEN");
            l.add(3, "IF LOWER(p_search_type) = 'exact' THEN");
            l.add(4, "v_where_clause := v_where_clause || ' AND (" + String.join(" OR ", exact) + ")';");
            l.add(3, "ELSE");
            l.add(4, "v_where_clause := v_where_clause || ' AND (" + String.join(" OR ", partial) + ")';");
            l.add(3, "END IF;");
            l.add(2, "END IF;");
            l.blank();
        }

        l.add(2, "v_sql := 'SELECT COUNT(*) FROM " + m.tableId + "' || v_where_clause;");
        if (searchable) {
            l.add(2, "IF v_query IS NULL THEN");
            l.add(3, "EXECUTE IMMEDIATE v_sql INTO v_total_count;");
            l.add(2, "ELSE");
            l.add(3, "EXECUTE IMMEDIATE v_sql INTO v_total_count" + using + ";");
            l.add(2, "END IF;");
        } else {
            l.add(2, "EXECUTE IMMEDIATE v_sql INTO v_total_count;");
        }
        l.add(2, "v_total_pages := CEIL(v_total_count / v_page_size);");
        l.blank();

        String pkColumns = m.pk.stream().map(this::col).collect(Collectors.joining(", "));
        l.add(2, "v_sql := 'SELECT " + pkColumns + " FROM " + m.tableId + "' || v_where_clause");
        l.add(2, "      || ' ORDER BY ' || UPPER(v_sort_by) || ' ' || v_sort_order || ', " + pkColumns + "'");
        l.add(2, "      || ' OFFSET ' || v_offset || ' ROWS FETCH NEXT ' || v_page_size || ' ROWS ONLY';");
        if (searchable) {
            l.add(2, "IF v_query IS NULL THEN");
            l.add(3, "OPEN c_records FOR v_sql;");
            l.add(2, "ELSE");
            l.add(3, "OPEN c_records FOR v_sql" + using + ";");
            l.add(2, "END IF;");
        } else {
            l.add(2, "OPEN c_records FOR v_sql;");
        }
        String fetchTargets = m.pk.stream().map(f -> "v_" + key(f)).collect(Collectors.joining(", "));
        l.add(2, "LOOP");
        l.add(3, "FETCH c_records INTO " + fetchTargets + ";");
        l.add(3, "EXIT WHEN c_records%NOTFOUND;");
        l.add(3, "v_data.append(get_record_object(" + fetchTargets + "));");
        l.add(2, "END LOOP;");
        l.add(2, "CLOSE c_records;");
        l.blank();
        l.add(2, "v_result.put('entity', '" + m.tableId.toLowerCase(Locale.ROOT) + "');");
        l.add(2, "v_result.put('records', v_data);");
        l.add(2, "v_result.put('page', v_page);");
        l.add(2, "v_result.put('page_size', v_page_size);");
        l.add(2, "v_result.put('total_records', v_total_count);");
        l.add(2, "v_result.put('total_pages', v_total_pages);");
        l.add(2, "v_result.put('sort_by', v_sort_by);");
        l.add(2, "v_result.put('sort_order', v_sort_order);");
        l.add(2, "v_result.put('query', p_query);");
        l.add(2, "v_result.put('search_type', NVL(LOWER(p_search_type), 'partial'));");
        l.add(2, "RETURN build_response('success', 'Records retrieved successfully', v_result, 200);");
        exceptionBlock(l, true);
        l.add(1, "END get_records;");
    }

    // Fragments

    private void validateCall(Lines l, Model m) {
        if (m.inputs.isEmpty()) {
            l.add(2, "validate_data;");
            return;
        }
        int width = m.inputs.stream().mapToInt(f -> param(f).length()).max().orElse(0);
        l.add(2, "validate_data(");
        List<String> args = new ArrayList<>();
        for (FieldModel f : m.inputs) {
            args.add(indent(3) + pad(param(f), width) + " => " + param(f));
        }
        l.raw(String.join(",\n", args));
        l.add(2, ");");
    }

    private void existenceCheck(Lines l, Model m) {
        l.add(2, "SELECT COUNT(*)");
        l.add(2, "  INTO l_count");
        l.add(2, "  FROM " + m.tableId);
        l.add(2, " WHERE " + pkPredicate(m, "", "p_") + ";");
        l.add(2, "IF l_count = 0 THEN");
        l.add(3, "RAISE_APPLICATION_ERROR(" + ERR_NOT_FOUND + ", 'Record not found');");
        l.add(2, "END IF;");
        l.blank();
    }

    private void exceptionBlock(Lines l, boolean closeCursor) {
        l.add(1, "EXCEPTION");
        l.add(2, "WHEN OTHERS THEN");
        if (closeCursor) {
            l.add(3, "IF c_records%ISOPEN THEN");
            l.add(4, "CLOSE c_records;");
            l.add(3, "END IF;");
        }
        l.add(3, "RETURN handle_all_exceptions(SQLCODE, SQLERRM);");
    }

    private String parameterList(Model m, List<FieldModel> fields, ParameterDefaults defaults) {
        if (fields.isEmpty()) return "";
        int width = fields.stream().mapToInt(f -> param(f).length()).max().orElse(0);
        List<String> params = new ArrayList<>();
        for (FieldModel f : fields) {
            params.add(indent(2) + pad(param(f), width) + " IN " + anchored(m, f) + parameterDefault(f, defaults));
        }
        return " (\n" + String.join(",\n", params) + "\n" + indent(1) + ")";
    }

    // an omitted argument must not override the column default with NULL
    private String parameterDefault(FieldModel f, ParameterDefaults defaults) {
        if (defaults == ParameterDefaults.NONE || f.isPrimaryKey()) return "";
        if (defaults == ParameterDefaults.COLUMN_DEFAULTS && f.hasDefault()) {
            return " DEFAULT " + dialect().getValueTransformer().defaultLiteral(f.getDefaultValue());
        }
        return f.isNullable() ? " DEFAULT NULL" : "";
    }

    private String pagingParameters(Model m) {
        return " (\n"
                + indent(2) + "p_page        IN NUMBER DEFAULT 1,\n"
                + indent(2) + "p_page_size   IN NUMBER DEFAULT " + DEFAULT_PAGE_SIZE + ",\n"
                + indent(2) + "p_sort_by     IN VARCHAR2 DEFAULT '" + key(m.pk.get(0)) + "',\n"
                + indent(2) + "p_sort_order  IN VARCHAR2 DEFAULT 'ASC',\n"
                + indent(2) + "p_query       IN VARCHAR2 DEFAULT NULL,\n"
                + indent(2) + "p_search_type IN VARCHAR2 DEFAULT 'partial'\n"
                + indent(1) + ")";
    }

    private String pkPredicate(Model m, String columnPrefix, String paramPrefix) {
        return m.pk.stream()
                .map(f -> columnPrefix + col(f) + " = " + paramPrefix + key(f))
                .collect(Collectors.joining(" AND "));
    }

    private String pkArguments(Model m, String prefix) {
        return m.pk.stream().map(f -> prefix + key(f)).collect(Collectors.joining(", "));
    }

    private String jsonValue(FieldModel f, String expression) {
        return dialect().categorize(f.getType()).isTemporal()
                ? "TO_CHAR(" + expression + ", " + JSON_TIMESTAMP_MASK + ")"
                : expression;
    }

    // doubled quotes: the expression lives inside a PL/SQL string literal
    private String searchExpression(FieldModel f) {
        if (dialect().categorize(f.getType()) == TypeCategory.LOB) {
            return "UPPER(DBMS_LOB.SUBSTR(" + col(f) + ", 4000, 1))";
        }
        return "UPPER(" + col(f) + ")";
    }

    private String anchored(Model m, FieldModel f) {
        return m.tableId + "." + col(f) + "%TYPE";
    }

    private String col(FieldModel f) {
        return id(f.getName());
    }

    private String key(FieldModel f) {
        return col(f).toLowerCase(Locale.ROOT);
    }

    private String param(FieldModel f) {
        return "p_" + key(f);
    }

    private String local(FieldModel f) {
        return "l_" + key(f);
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }

    /**
     * Field roles of one table, computed once per package.
     */
    private final class Model {
        final String tableId;
        final String packageName;
        final List<FieldModel> allFields;
        final List<FieldModel> pk;
        final boolean generatedKey;
        final List<FieldModel> inputs = new ArrayList<>();
        final List<FieldModel> createParams = new ArrayList<>();
        final List<FieldModel> updateParams = new ArrayList<>();
        final List<FieldModel> searchable = new ArrayList<>();
        final List<Join> joins = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        Model(TableModel table) {
            this.tableId = id(table.getName());
            this.packageName = naming().packageName(table.getName());
            this.allFields = table.getFields();
            this.pk = table.primaryKeyFields();
            this.generatedKey = pk.size() == 1 && dialect().categorize(pk.get(0).getType()) == TypeCategory.NUMBER;

            for (FieldModel f : allFields) {
                if (!f.isPrimaryKey() && !FieldRoles.isAudit(f, dialect())) {
                    inputs.add(f);
                }
                if (dialect().categorize(f.getType()).isSearchable()) {
                    searchable.add(f);
                }
            }
            if (!generatedKey) {
                createParams.addAll(pk);
            }
            createParams.addAll(inputs);
            updateParams.addAll(pk);
            updateParams.addAll(inputs);

            int alias = 1;
            for (FieldModel f : allFields) {
                if (!f.hasForeignKeyReference()) continue;
                ForeignKeyRef ref = f.getForeignKeyRef();
                Optional<TableModel> target = context.findTable(ref.getReferencedTable());
                if (target.isEmpty() || target.get().findField(ref.getReferencedColumn()).isEmpty()) {
                    warnings.add("CRUD package for " + table.getName() + " skips the lookup of " + f.getName()
                            + ": " + ref.getReferencedTable() + "." + ref.getReferencedColumn() + " is not in the schema");
                    continue;
                }
                joins.add(new Join(f, target.get(), ref.getReferencedColumn(), "r" + alias++));
            }
        }
    }

    /**
     * Lookup of a referenced row. The displayed columns come from the referenced table's own
     * definition: everything except its key and audit columns.
     */
    private final class Join {
        final FieldModel field;
        final String targetTable;
        final String targetColumn;
        final String alias;
        final List<FieldModel> displayFields;

        Join(FieldModel field, TableModel target, String referencedColumn, String alias) {
            this.field = field;
            this.targetTable = id(target.getName());
            this.targetColumn = id(referencedColumn);
            this.alias = alias;
            this.displayFields = target.getFields().stream()
                    .filter(d -> !d.isPrimaryKey())
                    .filter(d -> !FieldRoles.isAudit(d, dialect()))
                    .filter(d -> dialect().categorize(d.getType()) != TypeCategory.LOB)
                    .toList();
        }

        /** {@code <FK>_<COLUMN>}, clamped to the identifier limit. */
        String projectedName(FieldModel displayField) {
            return naming().columnAlias(field.getName(), displayField.getName());
        }
    }

    private enum ParameterDefaults {
        NONE,
        NULLS,
        COLUMN_DEFAULTS
    }

    /**
     * Line buffer with indentation by level.
     */
    private final class Lines {
        private final StringBuilder sb = new StringBuilder();

        void add(int level, String text) {
            sb.append(indent(level)).append(text).append('\n');
        }

        void raw(String text) {
            sb.append(text).append('\n');
        }

        void blank() {
            sb.append('\n');
        }

        @Override
        public String toString() {
            return sb.toString().stripTrailing();
        }
    }

    @Override
    public String sectionName() {
        return "CRUD PACKAGES";
    }

    @Override
    public String sectionDescription() {
        return "Data access package with create, read, update, delete and paging functions";
    }
}
