package net.neoforged.tidy.api;

import net.neoforged.tidy.api.model.SourceTree;

/**
 * Transformers are created through {@link SourceTransformerPlugin plugins}, and rewrite the statements of parsed files.
 * <p>
 * Transformers will be given to picocli for option collection, so they can accept CLI parameters.
 * It is <b>strongly recommended</b> that transformers prefix their options with the transformer name.
 * <p>
 * A transformer is shared by all files of a run, which may be visited concurrently. Per-file state belongs in the
 * visitor created for each file, not in the transformer.
 */
public interface SourceTransformer {
    /**
     * Invoked before source files are visited for transformation.
     * <p>
     * Can be used for validating CLI parameters.
     *
     * @param context the transform context
     */
    default void beforeRun(TransformContext context) {
    }

    /**
     * Invoked after all source transformations are finished.
     *
     * @param context the transform context
     * @return {@code true} if the transformation was successful, {@code false} otherwise
     */
    default boolean afterRun(TransformContext context) {
        return true;
    }

    /**
     * Visit the given {@code tree} for transformation. The tree is changed in place.
     * <p>
     * Statements inside ranges disabled for this transformer must be left untouched. Statements the transformer
     * cannot handle are left unchanged as well.
     *
     * @param tree    the file being transformed
     * @param context the file being transformed and its disabled ranges
     */
    void visitFile(SourceTree tree, FileContext context);
}
