package org.tablesmith.dialect;

import org.tablesmith.model.AllowedValue;

/**
 * Turns model values into dialect literals.
 */
public interface ValueTransformer {
    /** Quotes a text as a string literal, escaping embedded quotes. */
    String quote(String text);

    /** Renders the value of a DEFAULT clause. */
    String defaultLiteral(String rawDefault);

    /** Renders one member of an allowed-value list. */
    String allowedLiteral(AllowedValue value);

    /** Renders the right-hand side of a trigger assignment. */
    String triggerValue(String action);

    /** True for defaults that evaluate to the current time when a row is written. */
    boolean isLiveTimestamp(String rawDefault);
}
