package org.tablesmith.generator;

import org.junit.jupiter.api.Test;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;
import org.tablesmith.testing.Contexts;
import org.tablesmith.testing.Schemas;

import static org.assertj.core.api.Assertions.assertThat;

class CommentSectionGeneratorTest {

    @Test
    void columnComments() {
        TableModel customers = Schemas.customers();
        customers.findField("name").orElseThrow().setComment("Customer's full name");
        CommentSectionGenerator generator = new CommentSectionGenerator(Contexts.oracle(Schemas.of(customers)));

        assertThat(generator.generate(customers).orElseThrow().body()).isEqualTo(
                "COMMENT ON COLUMN CUSTOMERS.NAME IS 'Customer''s full name';\n"
                        + "COMMENT ON COLUMN CUSTOMERS.EMAIL IS 'Login address';");
    }

    @Test
    void noComments() {
        TableModel t = Schemas.table("t", FieldModel.builder().name("a").type("NUMBER").comment(" ").build());

        assertThat(new CommentSectionGenerator(Contexts.oracle(Schemas.of(t))).generate(t)).isEmpty();
    }
}
