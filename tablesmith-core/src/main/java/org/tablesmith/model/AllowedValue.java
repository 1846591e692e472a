package org.tablesmith.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One literal of a field's allowed-value set. The JSON form is either a string or a number;
 * numbers are emitted bare in SQL, strings quoted.
 */
public final class AllowedValue {
    private final String text;
    private final boolean numeric;

    private AllowedValue(String text, boolean numeric) {
        this.text = text;
        this.numeric = numeric;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AllowedValue from(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Allowed value must not be null");
        }
        if (raw instanceof Number n) {
            return number(n);
        }
        return text(raw.toString());
    }

    public static AllowedValue text(String value) {
        return new AllowedValue(Objects.requireNonNull(value, "value"), false);
    }

    public static AllowedValue number(Number value) {
        return new AllowedValue(Objects.requireNonNull(value, "value").toString(), true);
    }

    public String getText() {
        return text;
    }

    public boolean isNumeric() {
        return numeric;
    }

    @JsonValue
    public Object toJson() {
        if (!numeric) return text;
        return new BigDecimal(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllowedValue that)) return false;
        return numeric == that.numeric && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, numeric);
    }

    @Override
    public String toString() {
        return text;
    }
}
