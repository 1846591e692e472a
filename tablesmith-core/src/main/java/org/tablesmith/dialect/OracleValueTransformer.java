package org.tablesmith.dialect;

import org.tablesmith.model.AllowedValue;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public class OracleValueTransformer implements ValueTransformer {
    private static final Set<String> KEYWORD_DEFAULTS = Set.of(
            "SYSTIMESTAMP", "SYSDATE", "CURRENT_TIMESTAMP", "CURRENT_DATE", "LOCALTIMESTAMP", "USER"
    );
    private static final Set<String> LIVE_TIMESTAMPS = Set.of(
            "SYSTIMESTAMP", "SYSDATE", "CURRENT_TIMESTAMP", "CURRENT_DATE", "LOCALTIMESTAMP"
    );
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    @Override
    public String quote(String text) {
        if (text == null) return "NULL";
        return "'" + text.replace("'", "''") + "'";
    }

    @Override
    public String defaultLiteral(String rawDefault) {
        if (rawDefault == null) return null;
        String v = rawDefault.trim();
        String upper = v.toUpperCase(Locale.ROOT);
        if (KEYWORD_DEFAULTS.contains(upper)) {
            return upper;
        }
        if (isQuoted(v) || NUMERIC.matcher(v).matches() || "NULL".equals(upper)) {
            return v;
        }
        return quote(v);
    }

    @Override
    public String allowedLiteral(AllowedValue value) {
        return value.isNumeric() ? value.getText() : quote(value.getText());
    }

    @Override
    public String triggerValue(String action) {
        String v = action == null ? "" : action.trim();
        String upper = v.toUpperCase(Locale.ROOT);
        if (KEYWORD_DEFAULTS.contains(upper)) {
            return upper;
        }
        // quoted strings, numbers and arbitrary PL/SQL expressions pass through
        return v;
    }

    @Override
    public boolean isLiveTimestamp(String rawDefault) {
        return rawDefault != null && LIVE_TIMESTAMPS.contains(rawDefault.trim().toUpperCase(Locale.ROOT));
    }

    private boolean isQuoted(String v) {
        return v.length() >= 2 && v.startsWith("'") && v.endsWith("'");
    }
}
