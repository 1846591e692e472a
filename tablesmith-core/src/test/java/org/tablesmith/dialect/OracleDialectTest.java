package org.tablesmith.dialect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tablesmith.model.AllowedValue;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ScriptFormat;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OracleDialectTest {

    private OracleDialect dialect;

    @BeforeEach
    void setUp() {
        dialect = new OracleDialect();
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Upper-cases names")
        void upperCase() {
            assertThat(dialect.identifier("order_date")).isEqualTo("ORDER_DATE");
        }

        @Test
        @DisplayName("Appends an underscore to reserved words")
        void escapesKeywords() {
            assertThat(dialect.identifier("date")).isEqualTo("DATE_");
            assertThat(dialect.identifier("Level")).isEqualTo("LEVEL_");
        }
    }

    @Nested
    @DisplayName("Column definitions")
    class Columns {

        @Test
        @DisplayName("Pads the name and renders DEFAULT before NOT NULL")
        void defaultBeforeNotNull() {
            FieldModel field = FieldModel.builder().name("status").type("varchar2(20)")
                    .nullable(false).defaultValue("ACTIVE").build();

            String sql = dialect.getColumnDefinitionSql(field);

            assertThat(sql).startsWith("STATUS" + " ".repeat(24) + " VARCHAR2(20)");
            assertThat(sql).endsWith("DEFAULT 'ACTIVE' NOT NULL");
        }

        @Test
        @DisplayName("Keyword defaults are emitted bare")
        void keywordDefault() {
            FieldModel field = FieldModel.builder().name("created_at").type("TIMESTAMP").defaultValue("systimestamp").build();

            assertThat(dialect.getColumnDefinitionSql(field)).endsWith("TIMESTAMP DEFAULT SYSTIMESTAMP");
        }

        @Test
        @DisplayName("Nullable columns carry no NOT NULL")
        void nullable() {
            FieldModel field = FieldModel.builder().name("notes").type("CLOB").build();

            assertThat(dialect.getColumnDefinitionSql(field)).doesNotContain("NOT NULL").endsWith("CLOB");
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        void primaryKey() {
            assertThat(dialect.getPrimaryKeyConstraintSql("orders", "ORDERS_PK", List.of("id")))
                    .isEqualTo("ALTER TABLE ORDERS\n    ADD CONSTRAINT ORDERS_PK\n    PRIMARY KEY (ID);");
        }

        @Test
        void foreignKey() {
            assertThat(dialect.getForeignKeyConstraintSql("orders", "ORDERS_CUSTOMERS_FK", "customer_id", "customers", "id"))
                    .isEqualTo("ALTER TABLE ORDERS\n    ADD CONSTRAINT ORDERS_CUSTOMERS_FK\n"
                            + "    FOREIGN KEY (CUSTOMER_ID)\n    REFERENCES CUSTOMERS (ID);");
        }

        @Test
        @DisplayName("Check constraint quotes text and keeps numbers bare")
        void check() {
            String text = dialect.getCheckConstraintSql("t", "T_S_CK", "s",
                    List.of(AllowedValue.text("ACTIVE"), AllowedValue.text("O'NEIL")));
            String numbers = dialect.getCheckConstraintSql("t", "T_P_CK", "p",
                    List.of(AllowedValue.number(1), AllowedValue.number(2)));

            assertThat(text).endsWith("CHECK (S IN ('ACTIVE', 'O''NEIL'));");
            assertThat(numbers).endsWith("CHECK (P IN (1, 2));");
        }

        @Test
        @DisplayName("Indentation follows the script format")
        void indentFromFormat() {
            OracleDialect twoSpaces = new OracleDialect(ScriptFormat.builder().indentSize(2).build(), 30);

            assertThat(twoSpaces.getUniqueConstraintSql("t", "T_E_UK", "e"))
                    .isEqualTo("ALTER TABLE T\n  ADD CONSTRAINT T_E_UK\n  UNIQUE (E);");
        }
    }

    @Nested
    @DisplayName("Type analysis")
    class Types {

        @ParameterizedTest
        @CsvSource({
                "VARCHAR2(100), TEXT",
                "nvarchar2(10), TEXT",
                "CHAR(1), TEXT",
                "CLOB, LOB",
                "NUMBER(10), NUMBER",
                "INTEGER, NUMBER",
                "NUMBER(1), BOOLEAN",
                "DATE, DATE",
                "TIMESTAMP(6), TIMESTAMP",
                "TIMESTAMP WITH TIME ZONE, TIMESTAMP",
                "BLOB, OTHER",
                "RAW(16), OTHER"
        })
        void categorize(String type, TypeCategory expected) {
            assertThat(dialect.categorize(type)).isEqualTo(expected);
        }

        @Test
        void declaredLength() {
            assertThat(dialect.declaredLength("VARCHAR2(100 CHAR)")).hasValue(100);
            assertThat(dialect.declaredLength("CHAR(3)")).hasValue(3);
            assertThat(dialect.declaredLength("CLOB")).isEmpty();
        }

        @Test
        void precisionAndScale() {
            assertThat(dialect.integerDigits("NUMBER(10,2)")).hasValue(8);
            assertThat(dialect.fractionDigits("NUMBER(10,2)")).hasValue(2);
            assertThat(dialect.fractionDigits("NUMBER(5)")).hasValue(0);
            assertThat(dialect.fractionDigits("INTEGER")).hasValue(0);
            assertThat(dialect.fractionDigits("NUMBER")).isEmpty();
        }

        @Test
        void temporalLiterals() {
            LocalDateTime t = LocalDateTime.of(2024, 1, 2, 3, 4, 5);

            assertThat(dialect.temporalLiteral(t, TypeCategory.TIMESTAMP))
                    .isEqualTo("TO_TIMESTAMP('2024-01-02 03:04:05', 'YYYY-MM-DD HH24:MI:SS')");
            assertThat(dialect.temporalLiteral(t, TypeCategory.DATE))
                    .isEqualTo("TO_DATE('2024-01-02 03:04:05', 'YYYY-MM-DD HH24:MI:SS')");
        }
    }

    @Test
    @DisplayName("Column definitions delegate default rendering to the value transformer")
    void usesInjectedValueTransformer() {
        ValueTransformer transformer = mock(ValueTransformer.class);
        when(transformer.defaultLiteral(anyString())).thenReturn("42");
        OracleDialect custom = new OracleDialect(ScriptFormat.defaults(), new OracleIdentifierPolicy(30), transformer);
        FieldModel field = FieldModel.builder().name("answer").type("NUMBER").defaultValue("forty-two").build();

        assertThat(custom.getColumnDefinitionSql(field)).endsWith("NUMBER DEFAULT 42");
        verify(transformer).defaultLiteral("forty-two");
    }
}
