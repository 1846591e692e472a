package org.tablesmith.generator.seed;

import net.datafaker.Faker;
import org.tablesmith.dialect.Dialect;
import org.tablesmith.dialect.TypeCategory;
import org.tablesmith.model.AllowedValue;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;
import org.tablesmith.options.TablesmithOptions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Random;

/**
 * Synthesizes SQL literals for seed rows.
 *
 * <p>Values are a pure function of (table, field, row): each column gets its own {@link Faker}
 * seeded from the table and field names, so repeated runs emit identical scripts.
 */
public class SeedValueGenerator {

    public static final List<String> STATUS_VOCABULARY = List.of(
            "ACTIVE", "INACTIVE", "PENDING", "COMPLETED", "SUSPENDED",
            "IN_PROGRESS", "CANCELLED", "DRAFT", "PUBLISHED", "ARCHIVED"
    );

    static final LocalDateTime BASE_TIMESTAMP = LocalDateTime.of(2024, 1, 1, 9, 0, 0);

    private final Dialect dialect;
    private final int rowCount;

    public SeedValueGenerator(Dialect dialect) {
        this(dialect, TablesmithOptions.Data.ROW_COUNT);
    }

    public SeedValueGenerator(Dialect dialect, int rowCount) {
        if (rowCount < 1) {
            throw new IllegalArgumentException("rowCount must be positive: " + rowCount);
        }
        this.dialect = dialect;
        this.rowCount = rowCount;
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * Literals for rows 1..rowCount of one column.
     */
    public List<String> columnValues(TableModel table, FieldModel field) {
        Faker faker = new Faker(Locale.ENGLISH, new Random(seedOf(table, field)));
        List<String> values = new ArrayList<>(rowCount);
        for (int row = 1; row <= rowCount; row++) {
            values.add(value(table, field, row, faker));
        }
        return values;
    }

    /** Foreign keys wrap around the parent's row count so they always hit an emitted key. */
    public int foreignKeyIndex(int row) {
        return ((row - 1) % rowCount) + 1;
    }

    private String value(TableModel table, FieldModel field, int row, Faker faker) {
        TypeCategory category = dialect.categorize(field.getType());

        if (field.isPrimaryKey()) {
            return indexLiteral(row, category);
        }
        if (field.hasForeignKeyReference()) {
            return indexLiteral(foreignKeyIndex(row), category);
        }
        if (field.hasAllowedValues()) {
            List<AllowedValue> allowed = field.getAllowedValues();
            return dialect.getValueTransformer().allowedLiteral(allowed.get((row - 1) % allowed.size()));
        }

        return switch (category) {
            case TEXT, LOB -> dialect.getValueTransformer().quote(fit(field, textValue(table, field, row, faker), row));
            case NUMBER -> numberValue(field, row, faker);
            case DATE, TIMESTAMP -> dialect.temporalLiteral(temporalValue(field, row), category);
            case BOOLEAN -> dialect.booleanLiteral(row % 2 == 1);
            case OTHER -> field.isNullable() ? "NULL" : dialect.getValueTransformer().quote("DEFAULT_" + row);
        };
    }

    private String indexLiteral(int index, TypeCategory category) {
        return category == TypeCategory.TEXT || category == TypeCategory.LOB
                ? dialect.getValueTransformer().quote(String.valueOf(index))
                : String.valueOf(index);
    }

    String textValue(TableModel table, FieldModel field, int row, Faker faker) {
        String name = field.getName().toLowerCase(Locale.ROOT);

        if (name.contains("email")) {
            String first = faker.name().firstName().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
            String last = faker.name().lastName().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
            return first + "." + last + row + "@example.com";
        }
        if (name.contains("phone") || name.contains("mobile")) {
            return faker.phoneNumber().phoneNumber();
        }
        if (name.contains("status")) {
            return STATUS_VOCABULARY.get((row - 1) % STATUS_VOCABULARY.size());
        }
        if (name.contains("url") || name.contains("website")) {
            return faker.internet().url();
        }
        if (name.contains("address")) {
            return faker.address().streetAddress();
        }
        if (name.contains("city")) {
            return faker.address().city();
        }
        if (name.contains("country")) {
            return faker.address().country();
        }
        if (name.contains("color") || name.contains("colour")) {
            return faker.color().name();
        }
        if (name.contains("first_name") || name.contains("firstname")) {
            return faker.name().firstName();
        }
        if (name.contains("last_name") || name.contains("lastname") || name.contains("surname")) {
            return faker.name().lastName();
        }
        if (name.contains("company")) {
            return faker.company().name();
        }
        if (name.contains("username") || name.contains("login")) {
            return faker.name().firstName().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "") + row;
        }
        if (name.contains("name")) {
            String owner = table.getName().toLowerCase(Locale.ROOT);
            return owner.contains("product") || owner.contains("item")
                    ? faker.commerce().productName()
                    : faker.name().fullName();
        }
        if (name.contains("title")) {
            return faker.book().title();
        }
        if (name.contains("description") || name.contains("comment") || name.contains("note")) {
            return faker.lorem().sentence();
        }
        if (name.contains("code")) {
            return codePrefix(table.getName()) + "-" + String.format("%04d", row);
        }
        if (name.contains("category") || name.contains("type")) {
            return faker.commerce().department();
        }
        return field.getName().toUpperCase(Locale.ROOT) + " " + row;
    }

    String numberValue(FieldModel field, int row, Faker faker) {
        if (field.isUnique()) {
            return String.valueOf(row);
        }
        String name = field.getName().toLowerCase(Locale.ROOT);
        BigDecimal value;
        if (name.contains("priority")) {
            value = BigDecimal.valueOf(((row - 1) % 5) + 1);
        } else if (name.contains("quantity") || name.contains("count") || name.contains("qty") || name.contains("stock")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(1, 251));
        } else if (name.contains("amount") || name.contains("price") || name.contains("cost")
                || name.contains("total") || name.contains("salary") || name.contains("balance")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(1000, 999_901)).movePointLeft(2);
        } else if (name.contains("percent") || name.contains("rate")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(0, 101));
        } else if (name.contains("age")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(18, 96));
        } else if (name.contains("year")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(2020, 2026));
        } else if (name.contains("month")) {
            value = BigDecimal.valueOf(((row - 1) % 12) + 1);
        } else if (name.contains("day")) {
            value = BigDecimal.valueOf(((row - 1) % 28) + 1);
        } else if (name.contains("rating") || name.contains("score")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(1, 11));
        } else if (name.contains("weight")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(1, 201));
        } else if (name.contains("height")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(140, 211));
        } else if (name.contains("duration") || name.contains("minutes") || name.contains("time")) {
            value = BigDecimal.valueOf(faker.number().numberBetween(5, 481));
        } else {
            value = BigDecimal.valueOf(faker.number().numberBetween(1, 1001));
        }
        return fitNumber(field, value).toPlainString();
    }

    private BigDecimal fitNumber(FieldModel field, BigDecimal value) {
        OptionalInt scale = dialect.fractionDigits(field.getType());
        if (scale.isPresent()) {
            value = value.setScale(scale.getAsInt(), RoundingMode.DOWN);
        }
        OptionalInt digits = dialect.integerDigits(field.getType());
        if (digits.isPresent()) {
            BigDecimal limit = BigDecimal.TEN.pow(digits.getAsInt());
            if (value.abs().compareTo(limit) >= 0) {
                value = value.remainder(limit);
            }
        }
        return value.stripTrailingZeros();
    }

    private LocalDateTime temporalValue(FieldModel field, int row) {
        String name = field.getName().toLowerCase(Locale.ROOT);
        if (name.contains("birth") || name.contains("dob")) {
            return LocalDateTime.of(1970 + row, ((row - 1) % 12) + 1, ((row - 1) % 28) + 1, 0, 0);
        }
        return BASE_TIMESTAMP.plusDays((row - 1) * 3L).plusMinutes(row * 17L);
    }

    /**
     * Truncates to the declared length; unique columns keep a row suffix so rows never collide.
     */
    private String fit(FieldModel field, String value, int row) {
        String v = value;
        OptionalInt max = dialect.declaredLength(field.getType());
        boolean fits = max.isEmpty() || v.length() <= max.getAsInt();
        // emails carry the row number already, unless truncation would cut it off
        boolean rowEmbedded = field.getName().toLowerCase(Locale.ROOT).contains("email") && fits;
        String suffix = field.isUnique() && !rowEmbedded ? "-" + row : "";
        if (max.isPresent()) {
            int room = Math.max(0, max.getAsInt() - suffix.length());
            if (v.length() > room) {
                v = v.substring(0, room);
            }
        }
        return (v + suffix).trim();
    }

    private static String codePrefix(String table) {
        String letters = table.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        return letters.isEmpty() ? "CODE" : letters.substring(0, Math.min(3, letters.length()));
    }

    private static long seedOf(TableModel table, FieldModel field) {
        return (table.getName().toUpperCase(Locale.ROOT) + "." + field.getName().toUpperCase(Locale.ROOT)).hashCode();
    }
}
