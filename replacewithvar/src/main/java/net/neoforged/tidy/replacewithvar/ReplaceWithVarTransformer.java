package net.neoforged.tidy.replacewithvar;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.TransformContext;
import net.neoforged.tidy.api.model.KeywordNames;
import net.neoforged.tidy.api.model.SourceTree;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ReplaceWithVarTransformer implements SourceTransformer {
    @CommandLine.Option(
            names = "--replace-with-var-skip",
            split = ",",
            paramLabel = "KEYWORD",
            description = "Keywords that are not replaced, e.g. Catenate. Case, spaces and underscores are ignored."
    )
    public List<String> skip = new ArrayList<>();

    private final Set<LegacyKeyword> skipped = new HashSet<>();

    @Override
    public void beforeRun(TransformContext context) {
        skipped.clear();
        for (var name : skip) {
            var keyword = LegacyKeyword.byName(KeywordNames.normalize(name));
            if (keyword == null) {
                throw new IllegalArgumentException("ReplaceWithVAR cannot replace unknown keyword " + name);
            }
            skipped.add(keyword);
        }
    }

    @Override
    public void visitFile(SourceTree tree, FileContext context) {
        new ReplaceWithVarVisitor(context, new VarConverter(), skipped, context.config().separator()).visitFile(tree);
    }
}
