package org.tablesmith.dialect;

public interface IdentifierPolicy {
    int  maxLength();                      // 30 for Oracle 12.1, 128 afterwards
    String quote(String raw);              // "foo"
    String normalizeCase(String raw);      // Oracle -> upper case
    boolean isKeyword(String raw);         // reserved word check
}
