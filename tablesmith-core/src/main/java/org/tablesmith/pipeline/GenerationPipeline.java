package org.tablesmith.pipeline;

import org.tablesmith.assembler.AssembledScript;
import org.tablesmith.assembler.ScriptAssembler;
import org.tablesmith.generator.CommentSectionGenerator;
import org.tablesmith.generator.ConstraintSectionGenerator;
import org.tablesmith.generator.CrudPackageSectionGenerator;
import org.tablesmith.generator.DataSectionGenerator;
import org.tablesmith.generator.GenerationContext;
import org.tablesmith.generator.SectionGenerator;
import org.tablesmith.generator.TableSectionGenerator;
import org.tablesmith.generator.TriggerSectionGenerator;
import org.tablesmith.generator.ViewSectionGenerator;
import org.tablesmith.model.ArtifactCategory;
import org.tablesmith.model.GenerationResult;
import org.tablesmith.model.SchemaModel;
import org.tablesmith.model.ScriptArtifact;
import org.tablesmith.model.TableModel;
import org.tablesmith.model.naming.CaseNormalizer;
import org.tablesmith.resolver.DependencyResolver;
import org.tablesmith.resolver.Resolution;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs a schema through ordering, generation and assembly. One instance per run.
 */
public class GenerationPipeline {

    /**
     * One script family: which sections it contains and how its file is named.
     */
    public record ArtifactPlan(ArtifactCategory category, String title,
                               Function<String, String> fileName, List<SectionGenerator> generators) {
        public ArtifactPlan {
            generators = List.copyOf(generators);
        }
    }

    private final GenerationContext context;
    private final DependencyResolver resolver;
    private final ScriptAssembler assembler;
    private final List<ArtifactPlan> plans;
    private PipelineState state = PipelineState.RESOLVING;

    public GenerationPipeline(GenerationContext context) {
        this(context, Clock.systemDefaultZone());
    }

    public GenerationPipeline(GenerationContext context, Clock clock) {
        this(context, new DependencyResolver(), new ScriptAssembler(context, clock), defaultPlans(context));
    }

    public GenerationPipeline(GenerationContext context, DependencyResolver resolver,
                              ScriptAssembler assembler, List<ArtifactPlan> plans) {
        this.context = Objects.requireNonNull(context, "context");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.plans = List.copyOf(plans);
    }

    public static List<ArtifactPlan> defaultPlans(GenerationContext context) {
        CaseNormalizer lower = CaseNormalizer.lower();
        Function<String, String> id = name -> context.getDialect().identifier(name);
        return List.of(
                new ArtifactPlan(ArtifactCategory.TABLES, "Table", id,
                        List.of(new TableSectionGenerator(context),
                                new ConstraintSectionGenerator(context),
                                new TriggerSectionGenerator(context),
                                new CommentSectionGenerator(context))),
                new ArtifactPlan(ArtifactCategory.VIEWS, "View",
                        name -> context.getNaming().viewName(name),
                        List.of(new ViewSectionGenerator(context))),
                new ArtifactPlan(ArtifactCategory.DATA, "Data",
                        name -> lower.normalize(id.apply(name)) + "_data",
                        List.of(new DataSectionGenerator(context))),
                new ArtifactPlan(ArtifactCategory.PACKAGES, "Package",
                        name -> "p_" + lower.normalize(id.apply(name)),
                        List.of(new CrudPackageSectionGenerator(context)))
        );
    }

    public GenerationResult run(SchemaModel schema) {
        if (state != PipelineState.RESOLVING) {
            throw new IllegalStateException("Pipeline already ran (state " + state + "); create a new instance");
        }
        if (schema == null) {
            throw new IllegalArgumentException("Schema must not be null");
        }

        Resolution resolution = resolver.resolve(schema.getTables());
        List<String> warnings = new ArrayList<>(resolution.warnings());
        List<ScriptArtifact> artifacts = new ArrayList<>();
        state = PipelineState.GENERATING;

        String folder = context.getDialect().getDatabaseType().getFolder();
        int order = 1;
        for (TableModel table : resolution.orderedTables()) {
            for (ArtifactPlan plan : plans) {
                try {
                    Optional<AssembledScript> script = assembler.assemble(plan.title(), table, plan.generators());
                    if (script.isEmpty()) continue;
                    warnings.addAll(script.get().warnings());
                    artifacts.add(new ScriptArtifact(plan.category(), folder,
                            plan.fileName().apply(table.getName()), order, script.get().content()));
                } catch (RuntimeException e) {
                    warnings.add("Failed to generate " + plan.category().getFolder() + " script for table "
                            + table.getName() + ": " + e.getMessage());
                }
            }
            order++;
        }

        state = PipelineState.DONE;
        return GenerationResult.builder()
                .orderedTables(resolution.tableNames())
                .artifacts(artifacts)
                .warnings(warnings)
                .explanation(resolution.explanation())
                .build();
    }

    public PipelineState getState() {
        return state;
    }
}
