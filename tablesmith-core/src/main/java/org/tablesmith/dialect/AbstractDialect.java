package org.tablesmith.dialect;

import org.tablesmith.model.ScriptFormat;

public abstract class AbstractDialect implements Dialect {
    protected IdentifierPolicy identifierPolicy;
    protected ValueTransformer valueTransformer;
    protected final ScriptFormat format;

    protected AbstractDialect(ScriptFormat format, int maxNameLength) {
        this.format = format != null ? format : ScriptFormat.defaults();
        this.identifierPolicy = initializeIdentifierPolicy(maxNameLength);
        this.valueTransformer = initializeValueTransformer();
    }

    protected abstract IdentifierPolicy initializeIdentifierPolicy(int maxNameLength);
    protected abstract ValueTransformer initializeValueTransformer();

    @Override
    public IdentifierPolicy getIdentifierPolicy() {
        return identifierPolicy;
    }

    @Override
    public ValueTransformer getValueTransformer() {
        return valueTransformer;
    }

    @Override
    public ScriptFormat getFormat() {
        return format;
    }

    protected String indent() {
        return format.indent();
    }

    protected static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
