package net.neoforged.tidy.renamevariables;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.TransformContext;
import net.neoforged.tidy.api.model.SourceTree;
import net.neoforged.tidy.api.variables.VariableNames;
import net.neoforged.tidy.api.variables.VariableSearcher;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

public class RenameVariablesTransformer implements SourceTransformer {
    @CommandLine.Option(names = "--rename-variables-settings-section-case", description = "Case of variables in the Settings section: ${COMPLETION-CANDIDATES}")
    public NameCase settingsSectionCase = NameCase.UPPER;

    @CommandLine.Option(names = "--rename-variables-variables-section-case", description = "Case of variables in the Variables section: ${COMPLETION-CANDIDATES}")
    public NameCase variablesSectionCase = NameCase.UPPER;

    @CommandLine.Option(names = "--rename-variables-local-variables-case", description = "Case of variables local to a test, task or keyword: ${COMPLETION-CANDIDATES}")
    public NameCase localVariablesCase = NameCase.LOWER;

    @CommandLine.Option(names = "--rename-variables-unknown-variables-case", description = "Case of variables not defined in the current test, task or keyword: ${COMPLETION-CANDIDATES}")
    public NameCase unknownVariablesCase = NameCase.UPPER;

    @CommandLine.Option(names = "--rename-variables-separator", description = "Separator between words of a variable name: ${COMPLETION-CANDIDATES}")
    public VariableSeparator separator = VariableSeparator.UNDERSCORE;

    @CommandLine.Option(
            names = "--rename-variables-convert-camel-case",
            description = "Whether camelCase names are split into words",
            negatable = true,
            fallbackValue = "true"
    )
    public boolean convertCamelCase = true;

    @CommandLine.Option(
            names = "--rename-variables-ignore",
            split = ",",
            paramLabel = "NAME",
            description = "Variables that are never renamed, e.g. ${ignore_me}. Case, spaces and underscores are ignored."
    )
    public List<String> ignore = new ArrayList<>();

    private VariableRenamer renamer;

    @Override
    public void beforeRun(TransformContext context) {
        var ignored = new HashSet<String>();
        for (var name : ignore) {
            var match = VariableSearcher.matchWhole(name.strip());
            ignored.add(VariableNames.normalize(match != null ? match.base() : name));
        }
        renamer = new VariableRenamer(separator, convertCamelCase, ignored);
    }

    @Override
    public void visitFile(SourceTree tree, FileContext context) {
        if (renamer == null) {
            throw new IllegalStateException("beforeRun was not called");
        }
        var cases = new RenameVisitor.Cases(settingsSectionCase, variablesSectionCase, localVariablesCase, unknownVariablesCase);
        new RenameVisitor(context, renamer, cases).visitFile(tree);
    }
}
