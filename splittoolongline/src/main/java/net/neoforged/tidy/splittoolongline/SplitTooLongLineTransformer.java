package net.neoforged.tidy.splittoolongline;

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

public class SplitTooLongLineTransformer implements SourceTransformer {
    @CommandLine.Option(
            names = "--split-too-long-line-split-on-every-arg",
            description = "Put every argument of a keyword call on its own line instead of filling lines",
            negatable = true,
            fallbackValue = "true"
    )
    public boolean splitOnEveryArg = false;

    @CommandLine.Option(
            names = "--split-too-long-line-split-on-every-value",
            description = "Put every value of a variable or VAR statement on its own line instead of filling lines",
            negatable = true,
            fallbackValue = "true"
    )
    public boolean splitOnEveryValue = false;

    @CommandLine.Option(
            names = "--split-too-long-line-skip-keyword-call",
            split = ",",
            paramLabel = "KEYWORD",
            description = "Never split calls of these keywords. Case, spaces and underscores are ignored."
    )
    public List<String> skipKeywordCalls = new ArrayList<>();

    @CommandLine.Option(names = "--split-too-long-line-line-length", description = "Overrides the global --line-length for this transformer")
    public Integer lineLength;

    private final Set<String> skippedKeywords = new HashSet<>();

    @Override
    public void beforeRun(TransformContext context) {
        if (lineLength != null && lineLength < 1) {
            throw new IllegalArgumentException("SplitTooLongLine line length must be positive, was " + lineLength);
        }
        skippedKeywords.clear();
        for (var keyword : skipKeywordCalls) {
            skippedKeywords.add(KeywordNames.normalize(keyword));
        }
    }

    @Override
    public void visitFile(SourceTree tree, FileContext context) {
        var config = context.config();
        var options = new SplitOptions(
                lineLength != null ? lineLength : config.lineLength(),
                splitOnEveryArg,
                splitOnEveryValue,
                skippedKeywords
        );
        new LineSplitter(context, options, config.lineSeparator(tree)).visitFile(tree);
    }

    record SplitOptions(int lineLength, boolean splitOnEveryArg, boolean splitOnEveryValue, Set<String> skippedKeywords) {
    }
}
