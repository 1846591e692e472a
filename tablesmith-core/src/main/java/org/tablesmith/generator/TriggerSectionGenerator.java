package org.tablesmith.generator;

import org.tablesmith.model.FieldModel;
import org.tablesmith.model.TableModel;
import org.tablesmith.model.TriggerEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One row-level trigger per distinct (event, condition) pair of the table's trigger-enabled fields.
 */
public class TriggerSectionGenerator extends AbstractSectionGenerator {

    public TriggerSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        Map<GroupKey, List<FieldModel>> groups = new LinkedHashMap<>();
        for (FieldModel f : table.getFields()) {
            if (!f.hasEnabledTrigger()) continue;
            GroupKey key = new GroupKey(f.getTrigger().effectiveEvent(), f.getTrigger().effectiveCondition());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(f);
        }
        if (groups.isEmpty()) {
            return Optional.empty();
        }

        List<String> warnings = new ArrayList<>();
        Map<TriggerEvent, Integer> conditionalCount = new HashMap<>();
        List<String> triggers = new ArrayList<>();
        for (var entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            int ordinal = 0;
            if (key.condition() != null) {
                ordinal = conditionalCount.merge(key.event(), 1, Integer::sum);
            }
            String name = naming().triggerName(table.getName(), key.event(), ordinal);
            if (key.event().isAfter()) {
                warnings.add("Trigger " + name + " assigns :NEW values in an AFTER trigger; Oracle only allows that in BEFORE triggers");
            }
            triggers.add(buildTrigger(table, name, key, entry.getValue()));
        }
        return section(String.join("\n\n", triggers), warnings);
    }

    private String buildTrigger(TableModel table, String name, GroupKey key, List<FieldModel> fields) {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE OR REPLACE TRIGGER ").append(name).append('\n')
                .append(indent(1)).append(key.event().getTiming()).append(' ')
                .append(key.event().operationClause()).append(" ON ").append(id(table.getName())).append('\n')
                .append(indent(1)).append("FOR EACH ROW\n");
        if (key.condition() != null) {
            sb.append(indent(1)).append("WHEN ").append(parenthesize(key.condition())).append('\n');
        }
        sb.append("BEGIN\n");
        for (FieldModel f : fields) {
            sb.append(indent(1)).append("-- Auto-update ").append(id(f.getName())).append('\n')
                    .append(indent(1)).append(":NEW.").append(id(f.getName())).append(" := ")
                    .append(dialect().getValueTransformer().triggerValue(f.getTrigger().effectiveAction()))
                    .append(";\n");
        }
        sb.append("END ").append(name).append(";\n/");
        return sb.toString();
    }

    static String parenthesize(String condition) {
        return isWrapped(condition) ? condition : "(" + condition + ")";
    }

    // true when the opening '(' is closed by the last character; quoted literals are skipped
    private static boolean isWrapped(String condition) {
        if (!condition.startsWith("(") || !condition.endsWith(")")) return false;
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < condition.length(); i++) {
            char c = condition.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) return i == condition.length() - 1;
            }
        }
        return false;
    }

    private record GroupKey(TriggerEvent event, String condition) {
        GroupKey {
            Objects.requireNonNull(event, "event");
        }
    }

    @Override
    public String sectionName() {
        return "TABLE TRIGGERS";
    }

    @Override
    public String sectionDescription() {
        return "Auto-generated triggers for field updates";
    }
}
