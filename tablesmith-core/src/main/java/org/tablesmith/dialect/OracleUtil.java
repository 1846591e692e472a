package org.tablesmith.dialect;

import java.util.Locale;
import java.util.Set;

/**
 * Oracle reserved words and the escaping applied to identifiers that collide with them.
 */
public final class OracleUtil {

    private OracleUtil() {}

    // Oracle SQL reserved words (V$RESERVED_WORDS where RESERVED = 'Y')
    private static final Set<String> ORACLE_KEYWORDS = Set.of(
            "ACCESS", "ADD", "ALL", "ALTER", "AND", "ANY", "AS", "ASC", "AUDIT",
            "BETWEEN", "BY", "CHAR", "CHECK", "CLUSTER", "COLUMN", "COMMENT",
            "COMPRESS", "CONNECT", "CREATE", "CURRENT", "DATE", "DECIMAL",
            "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP", "ELSE", "EXCLUSIVE",
            "EXISTS", "FILE", "FLOAT", "FOR", "FROM", "GRANT", "GROUP", "HAVING",
            "IDENTIFIED", "IMMEDIATE", "IN", "INCREMENT", "INDEX", "INITIAL",
            "INSERT", "INTEGER", "INTERSECT", "INTO", "IS", "LEVEL", "LIKE",
            "LOCK", "LONG", "MAXEXTENTS", "MINUS", "MLSLABEL", "MODE", "MODIFY",
            "NOAUDIT", "NOCOMPRESS", "NOT", "NOWAIT", "NULL", "NUMBER", "OF",
            "OFFLINE", "ON", "ONLINE", "OPTION", "OR", "ORDER", "PCTFREE", "PRIOR",
            "PUBLIC", "RAW", "RENAME", "RESOURCE", "REVOKE", "ROW", "ROWID",
            "ROWNUM", "ROWS", "SELECT", "SESSION", "SET", "SHARE", "SIZE",
            "SMALLINT", "START", "SUCCESSFUL", "SYNONYM", "SYSDATE", "TABLE",
            "THEN", "TO", "TRIGGER", "UID", "UNION", "UNIQUE", "UPDATE", "USER",
            "VALIDATE", "VALUES", "VARCHAR", "VARCHAR2", "VIEW", "WHENEVER",
            "WHERE", "WITH"
    );

    public static boolean isKeyword(String identifier) {
        return identifier != null && ORACLE_KEYWORDS.contains(identifier.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Appends an underscore to reserved words so they can be used unquoted.
     */
    public static String escapeKeyword(String identifier) {
        if (isKeyword(identifier)) {
            return identifier + "_";
        }
        return identifier;
    }
}
