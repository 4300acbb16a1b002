package net.neoforged.tidy.api;

import net.neoforged.tidy.api.model.SourceTree;

import java.util.List;

/**
 * Runs transformers one after the other on a single file. Each one sees the tree as the previous one left it.
 */
public final class TransformerPipeline {
    public record Stage(TransformerId id, SourceTransformer transformer) {
    }

    private final List<Stage> stages;

    public TransformerPipeline(List<Stage> stages) {
        this.stages = List.copyOf(stages);
    }

    public List<Stage> stages() {
        return stages;
    }

    public void run(SourceTree tree, FileContext context) {
        for (var stage : stages) {
            if (context.disablers().isDisabledInFile(stage.id())) {
                context.logger().debug("%s is disabled in %s", stage.id(), context.file());
                continue;
            }
            try {
                stage.transformer().visitFile(tree, context);
            } catch (RuntimeException e) {
                // visitors already isolate failing statements, this only catches failures outside of them
                context.problemReporter().reportFileProblem(TidyProblems.TRANSFORMER_FAILURE, ProblemSeverity.WARNING,
                        context.file(), stage.id() + " failed: " + e);
                context.logger().error("%s failed on %s: %s", stage.id(), context.file(), e);
            }
        }
    }
}
