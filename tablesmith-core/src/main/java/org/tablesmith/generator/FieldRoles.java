package org.tablesmith.generator;

import org.tablesmith.dialect.Dialect;
import org.tablesmith.dialect.TypeCategory;
import org.tablesmith.model.FieldModel;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies fields by how the database treats them.
 */
public final class FieldRoles {
    private static final Pattern AUDIT_NAME =
            Pattern.compile("^(created|updated|modified|last_updated|last_modified)_(at|on|by|date|time|timestamp)$");
    private static final Pattern CREATE_STAMP = Pattern.compile("^created_(at|on|by|date|time|timestamp)$");
    private static final Pattern UPDATE_STAMP = Pattern.compile("^(updated|modified|last_updated|last_modified)_(at|on|by|date|time|timestamp)$");

    private FieldRoles() {}

    /**
     * Filled in by the database itself: a current-time default or an enabled trigger.
     */
    public static boolean isDatabaseManaged(FieldModel field, Dialect dialect) {
        return field.hasEnabledTrigger()
                || (field.hasDefault() && dialect.getValueTransformer().isLiveTimestamp(field.getDefaultValue()));
    }

    /**
     * System-maintained bookkeeping columns, never part of CRUD input. A conventionally named column
     * only counts when something fills it: its default, or the stamp the CRUD package writes.
     */
    public static boolean isAudit(FieldModel field, Dialect dialect) {
        if (field.isPrimaryKey()) return false;
        if (isDatabaseManaged(field, dialect)) return true;
        if (!AUDIT_NAME.matcher(lower(field.getName())).matches()) return false;
        if (field.hasDefault()) return true;
        return field.isNullable() && stampValue(field, dialect).isPresent();
    }

    /**
     * Value the CRUD create writes into a {@code created_*} audit column the database leaves empty.
     */
    public static Optional<String> createStamp(FieldModel field, Dialect dialect) {
        if (field.hasDefault()) return Optional.empty();
        return stamp(field, dialect, CREATE_STAMP);
    }

    /**
     * Value the CRUD update writes into an {@code updated_*} audit column because no trigger does it.
     * A current-time default only covers the insert, so it does not count here.
     */
    public static Optional<String> updateStamp(FieldModel field, Dialect dialect) {
        return stamp(field, dialect, UPDATE_STAMP);
    }

    private static Optional<String> stamp(FieldModel field, Dialect dialect, Pattern names) {
        if (!isAudit(field, dialect) || field.hasEnabledTrigger() || !names.matcher(lower(field.getName())).matches()) {
            return Optional.empty();
        }
        return stampValue(field, dialect);
    }

    // SYSTIMESTAMP for temporal columns, USER for *_by text columns
    private static Optional<String> stampValue(FieldModel field, Dialect dialect) {
        TypeCategory category = dialect.categorize(field.getType());
        if (lower(field.getName()).endsWith("_by")) {
            return category == TypeCategory.TEXT ? Optional.of("USER") : Optional.empty();
        }
        return category.isTemporal() ? Optional.of("SYSTIMESTAMP") : Optional.empty();
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
