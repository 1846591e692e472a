package org.tablesmith.assembler;

import org.tablesmith.generator.GenerationContext;
import org.tablesmith.generator.ScriptSection;
import org.tablesmith.generator.SectionGenerator;
import org.tablesmith.model.ProjectMetadata;
import org.tablesmith.model.TableModel;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Joins the sections of one table into a script with header and footer banners.
 */
public class ScriptAssembler {
    public static final String BANNER = "-- " + "=".repeat(60);
    public static final String TIMESTAMP_PLACEHOLDER = "[timestamp]";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String FOOTER_PREFIX = "END OF SCRIPT FOR TABLE: ";

    private final GenerationContext context;
    private final Clock clock;

    public ScriptAssembler(GenerationContext context) {
        this(context, Clock.systemDefaultZone());
    }

    public ScriptAssembler(GenerationContext context, Clock clock) {
        this.context = Objects.requireNonNull(context, "context");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param title script kind printed in the header, e.g. {@code Table}
     * @return the script, or empty when no generator produced a section
     */
    public Optional<AssembledScript> assemble(String title, TableModel table, List<SectionGenerator> generators) {
        List<ScriptSection> sections = new ArrayList<>();
        for (SectionGenerator generator : generators) {
            generator.generate(table).ifPresent(sections::add);
        }
        if (sections.isEmpty()) {
            return Optional.empty();
        }

        String tableName = context.getDialect().identifier(table.getName());
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, title, tableName);
        for (ScriptSection section : sections) {
            sb.append('\n');
            appendSection(sb, section);
        }
        sb.append('\n');
        appendFooter(sb, tableName);

        String content = sb.toString();
        List<String> warnings = new ArrayList<>();
        sections.forEach(s -> warnings.addAll(s.warnings()));
        warnings.addAll(selfCheck(content, sections, tableName));
        return Optional.of(new AssembledScript(content, warnings));
    }

    private void appendHeader(StringBuilder sb, String title, String tableName) {
        ProjectMetadata metadata = context.getMetadata();
        String dialect = context.getDialect().getDatabaseType().getDisplayName();
        sb.append(BANNER).append('\n')
                .append("-- TABLESMITH ").append(dialect.toUpperCase(Locale.ROOT)).append(" DATABASE SCRIPT\n")
                .append(BANNER).append('\n')
                .append(headerLine("Script", title))
                .append(headerLine("Target", tableName))
                .append(headerLine("Dialect", dialect))
                .append(headerLine("Generated", timestamp()))
                .append(headerLine("Author", metadata.getAuthor()))
                .append(headerLine("License", metadata.getLicense()));
        if (metadata.getDescription() != null) {
            sb.append(headerLine("Description", metadata.getDescription()));
        }
        sb.append(BANNER).append('\n');
    }

    private static String headerLine(String label, String value) {
        return String.format("-- %-12s %s", label + ":", value) + "\n";
    }

    private static void appendSection(StringBuilder sb, ScriptSection section) {
        sb.append(BANNER).append('\n')
                .append("-- ").append(section.name()).append('\n')
                .append("-- ").append(section.description()).append('\n')
                .append(BANNER).append('\n')
                .append(section.body().strip()).append('\n');
    }

    private static void appendFooter(StringBuilder sb, String tableName) {
        sb.append(BANNER).append('\n')
                .append("-- ").append(FOOTER_PREFIX).append(tableName).append('\n')
                .append(BANNER).append('\n');
    }

    private String timestamp() {
        if (!context.getFormat().isIncludeTimestamps()) {
            return TIMESTAMP_PLACEHOLDER;
        }
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    // Structural check; findings are reported, the script is kept as is.
    private static List<String> selfCheck(String content, List<ScriptSection> sections, String tableName) {
        List<String> warnings = new ArrayList<>();
        long markers = content.lines().filter(BANNER::equals).count();
        if (markers < 2) {
            warnings.add("Script for " + tableName + " has fewer than two section markers");
        }
        if (!content.contains(" DATABASE SCRIPT")) {
            warnings.add("Script for " + tableName + " is missing its header banner");
        }
        if (!content.contains(FOOTER_PREFIX + tableName)) {
            warnings.add("Script for " + tableName + " is missing its footer banner");
        }
        for (ScriptSection section : sections) {
            String body = section.body();
            if (body.contains("CREATE TABLE") && body.lines().noneMatch(l -> l.startsWith(" "))) {
                warnings.add("Section " + section.name() + " of " + tableName + " has a CREATE TABLE without indented columns");
            }
        }
        return warnings;
    }
}
