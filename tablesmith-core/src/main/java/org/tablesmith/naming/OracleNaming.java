package org.tablesmith.naming;

import org.tablesmith.model.TriggerEvent;
import org.tablesmith.model.naming.CaseNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class OracleNaming implements Naming {
    private static final CaseNormalizer UPPER = CaseNormalizer.upper();
    private static final CaseNormalizer LOWER = CaseNormalizer.lower();

    private final int maxLength;

    public OracleNaming(int maxNameLength) {
        if (maxNameLength < 10) {
            throw new IllegalArgumentException("maxNameLength must be at least 10: " + maxNameLength);
        }
        this.maxLength = maxNameLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    @Override
    public String pkName(String table) {
        return clampWithHash(norm(table) + "_PK");
    }

    @Override
    public String fkName(String table, String referencedTable, String field) {
        String base = norm(table) + "_" + norm(referencedTable);
        if (field != null) {
            base += "_" + norm(field);
        }
        return clampWithHash(base + "_FK");
    }

    @Override
    public String ukName(String table, String field) {
        return clampWithHash(norm(table) + "_" + norm(field) + "_UK");
    }

    @Override
    public String ckName(String table, String field) {
        return clampWithHash(norm(table) + "_" + norm(field) + "_CK");
    }

    @Override
    public String triggerName(String table, TriggerEvent event, int conditionOrdinal) {
        StringBuilder sb = new StringBuilder(norm(table)).append('_').append(event.getAbbreviation());
        if (conditionOrdinal == 1) {
            sb.append("_COND");
        } else if (conditionOrdinal > 1) {
            sb.append("_COND").append(conditionOrdinal);
        }
        return clampWithHash(sb.append("_TRG").toString());
    }

    @Override
    public String viewName(String table) {
        return LOWER.normalize(clampWithHash(norm(table) + "_V"));
    }

    @Override
    public String packageName(String table) {
        return LOWER.normalize(clampWithHash("PKG_" + norm(table)));
    }

    @Override
    public String columnAlias(String field, String column) {
        return clampWithHash(norm(field) + "_" + norm(column));
    }

    /**
     * Upper case, anything outside [A-Z0-9_] becomes '_', runs of '_' collapse.
     */
    private String norm(String s) {
        if (s == null) return "NULL";
        String x = UPPER.normalize(s).replaceAll("[^A-Z0-9_]", "_").replaceAll("_+", "_");
        if (x.isEmpty() || x.chars().allMatch(ch -> ch == '_')) {
            return "X";
        }
        return x;
    }

    // Over-long names keep their head and end in '_' + 8 hex chars of SHA-256.
    private String clampWithHash(String name) {
        if (name.length() <= maxLength) return name;
        String hash = computeStableHash(name);
        int keep = Math.max(1, maxLength - (hash.length() + 1));
        return name.substring(0, keep) + "_" + hash;
    }

    private String computeStableHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return String.format("%02X%02X%02X%02X", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
