package org.tablesmith.generator;

import org.tablesmith.dialect.Dialect;
import org.tablesmith.model.ScriptFormat;
import org.tablesmith.naming.Naming;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public abstract class AbstractSectionGenerator implements SectionGenerator {
    protected final GenerationContext context;

    protected AbstractSectionGenerator(GenerationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    protected Dialect dialect() {
        return context.getDialect();
    }

    protected Naming naming() {
        return context.getNaming();
    }

    protected ScriptFormat format() {
        return context.getFormat();
    }

    protected String indent(int levels) {
        return format().indent(levels);
    }

    protected String id(String raw) {
        return dialect().identifier(raw);
    }

    protected Optional<ScriptSection> section(String body) {
        return section(body, List.of());
    }

    protected Optional<ScriptSection> section(String body, List<String> warnings) {
        return Optional.of(new ScriptSection(sectionName(), sectionDescription(), body, warnings));
    }
}
