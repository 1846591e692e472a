package org.tablesmith.dialect;

import org.tablesmith.model.naming.CaseNormalizer;

class OracleIdentifierPolicy implements IdentifierPolicy {
    private static final CaseNormalizer UPPER = CaseNormalizer.upper();

    private final int maxLength;

    OracleIdentifierPolicy(int maxLength) {
        this.maxLength = maxLength;
    }

    public int maxLength()                  { return maxLength; }
    public String quote(String raw)         { return "\"" + raw + "\""; }
    public String normalizeCase(String raw) { return UPPER.normalize(raw); }
    public boolean isKeyword(String raw)    { return OracleUtil.isKeyword(raw); }
}
