package org.tablesmith.generator;

import org.tablesmith.generator.contributor.CheckContributor;
import org.tablesmith.generator.contributor.ForeignKeyContributor;
import org.tablesmith.generator.contributor.PrimaryKeyContributor;
import org.tablesmith.generator.contributor.UniqueContributor;
import org.tablesmith.model.FieldModel;
import org.tablesmith.model.ForeignKeyRef;
import org.tablesmith.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Primary key, foreign keys, unique and check constraints, in that order.
 */
public class ConstraintSectionGenerator extends AbstractSectionGenerator {

    public ConstraintSectionGenerator(GenerationContext context) {
        super(context);
    }

    @Override
    public Optional<ScriptSection> generate(TableModel table) {
        String tableName = table.getName();
        AlterTableBuilder builder = new AlterTableBuilder(tableName, dialect());
        List<String> warnings = new ArrayList<>();

        List<String> pkColumns = table.primaryKeyFields().stream().map(FieldModel::getName).toList();
        if (!pkColumns.isEmpty()) {
            builder.add(new PrimaryKeyContributor(tableName, naming().pkName(tableName), pkColumns));
        }

        List<FieldModel> foreignKeys = resolvableForeignKeys(table, warnings);
        Map<String, Long> perTarget = foreignKeys.stream()
                .collect(Collectors.groupingBy(f -> upper(f.getForeignKeyRef().getReferencedTable()), Collectors.counting()));
        for (FieldModel f : foreignKeys) {
            ForeignKeyRef ref = f.getForeignKeyRef();
            // several keys to the same parent need the column in the name to stay distinct
            String disambiguator = perTarget.get(upper(ref.getReferencedTable())) > 1 ? f.getName() : null;
            builder.add(new ForeignKeyContributor(tableName,
                    naming().fkName(tableName, ref.getReferencedTable(), disambiguator),
                    f.getName(), ref.getReferencedTable(), ref.getReferencedColumn()));
        }

        for (FieldModel f : table.getFields()) {
            if (f.isUnique() && !f.isPrimaryKey()) {
                builder.add(new UniqueContributor(tableName, naming().ukName(tableName, f.getName()), f.getName()));
            }
        }

        for (FieldModel f : table.getFields()) {
            if (f.hasAllowedValues()) {
                builder.add(new CheckContributor(tableName, naming().ckName(tableName, f.getName()),
                        f.getName(), f.getAllowedValues()));
            }
        }

        if (builder.isEmpty()) {
            return warnings.isEmpty()
                    ? Optional.empty()
                    : Optional.of(new ScriptSection(sectionName(), sectionDescription(), "-- No constraints defined", warnings));
        }
        return section(builder.build(), warnings);
    }

    /**
     * Foreign key fields whose target table and column exist in the schema. The rest are reported.
     */
    private List<FieldModel> resolvableForeignKeys(TableModel table, List<String> warnings) {
        List<FieldModel> result = new ArrayList<>();
        for (FieldModel f : table.getFields()) {
            if (!f.isForeignKey()) continue;
            String where = table.getName() + "." + f.getName();
            if (!f.hasForeignKeyReference()) {
                warnings.add("Skipping foreign key " + where + ": no referenced table/column given");
                continue;
            }
            ForeignKeyRef ref = f.getForeignKeyRef();
            Optional<TableModel> target = context.findTable(ref.getReferencedTable());
            if (target.isEmpty()) {
                warnings.add("Skipping foreign key " + where + ": referenced table "
                        + ref.getReferencedTable() + " does not exist in the schema");
                continue;
            }
            if (target.get().findField(ref.getReferencedColumn()).isEmpty()) {
                warnings.add("Skipping foreign key " + where + ": column " + ref.getReferencedColumn()
                        + " does not exist in table " + target.get().getName());
                continue;
            }
            result.add(f);
        }
        return result;
    }

    private static String upper(String s) {
        return s.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String sectionName() {
        return "TABLE CONSTRAINTS";
    }

    @Override
    public String sectionDescription() {
        return "Primary keys, foreign keys, unique constraints, and check constraints";
    }
}
