package net.neoforged.tidy.renamevariables;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.StatementVisitor;
import net.neoforged.tidy.api.TransformerId;
import net.neoforged.tidy.api.model.Block;
import net.neoforged.tidy.api.model.KeywordNames;
import net.neoforged.tidy.api.model.Section;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.StatementType;
import net.neoforged.tidy.api.model.Token;
import net.neoforged.tidy.api.model.TokenType;
import net.neoforged.tidy.api.variables.VariableMatch;
import net.neoforged.tidy.api.variables.VariableNames;
import net.neoforged.tidy.api.variables.VariableSearcher;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renames variables of one file, tracking which variables are local to the test, task or keyword being visited.
 * <p>
 * A variable becomes local by being assigned, by {@code VAR}, by {@code FOR} or by being a keyword argument, starting
 * with the statement defining it. Disabled statements are not rewritten, but the variables they define still count.
 */
final class RenameVisitor extends StatementVisitor {
    record Cases(NameCase settingsSection, NameCase variablesSection, NameCase local, NameCase unknown) {
    }

    private static final Set<String> PROMOTING_KEYWORDS = Set.of("settestvariable", "settaskvariable", "setsuitevariable", "setglobalvariable");
    private static final String SET_LOCAL_VARIABLE = "setlocalvariable";

    private final VariableRenamer renamer;
    private final Cases cases;
    private final Set<String> locals = new HashSet<>();
    @Nullable
    private Block currentBlock;

    private final VariableRenamer.CaseResolver blockCase;
    private final VariableRenamer.CaseResolver unknownCase;

    RenameVisitor(FileContext context, VariableRenamer renamer, Cases cases) {
        super(TransformerId.RENAME_VARIABLES, context);
        this.renamer = renamer;
        this.cases = cases;
        this.blockCase = name -> locals.contains(name) ? cases.local() : cases.unknown();
        this.unknownCase = name -> cases.unknown();
    }

    @Override
    protected void visitStatement(Section section, @Nullable Block block, Statement statement) {
        if (block != currentBlock) {
            locals.clear();
            currentBlock = block;
        }
        var rewrite = new Rewrite(statement, isDisabled(statement));
        switch (section.type()) {
            case SETTINGS -> renameSetting(rewrite);
            case VARIABLES -> renameVariable(rewrite);
            case TEST_CASES, TASKS, KEYWORDS -> {
                if (block != null) {
                    renameInBlock(rewrite);
                }
            }
            default -> {
            }
        }
        rewrite.apply();
    }

    private void renameSetting(Rewrite rewrite) {
        var statement = rewrite.statement;
        if (statement.type() != StatementType.SUITE_SETTING || statement.getToken(TokenType.DOCUMENTATION) != null) {
            return;
        }
        VariableRenamer.CaseResolver settingsCase = name -> cases.settingsSection();
        rewrite.renameAll(settingsCase, TokenType.NAME, TokenType.ARGUMENT);
    }

    private void renameVariable(Rewrite rewrite) {
        if (rewrite.statement.type() != StatementType.VARIABLE) {
            return;
        }
        VariableRenamer.CaseResolver variablesCase = name -> cases.variablesSection();
        rewrite.renameAll(variablesCase, TokenType.VARIABLE, TokenType.ARGUMENT);
    }

    private void renameInBlock(Rewrite rewrite) {
        switch (rewrite.statement.type()) {
            case KEYWORD_NAME -> renameKeywordName(rewrite);
            case BLOCK_SETTING -> renameBlockSetting(rewrite);
            case KEYWORD_CALL -> renameKeywordCall(rewrite);
            case VAR -> renameVar(rewrite);
            case FOR_HEADER -> {
                rewrite.renameAll(blockCase, TokenType.ARGUMENT);
                for (int i : rewrite.indexes(TokenType.VARIABLE)) {
                    rewrite.define(i, true);
                }
            }
            case EXCEPT_HEADER -> renameExcept(rewrite);
            case TESTCASE_NAME, COMMENT, EMPTY_LINE, ERROR -> {
            }
            default -> rewrite.renameAll(blockCase, TokenType.ARGUMENT, TokenType.NAME);
        }
    }

    /**
     * Embedded arguments such as {@code Open ${page:\w+} Page} are locals of the keyword. The pattern after
     * {@code :} is kept as is.
     */
    private void renameKeywordName(Rewrite rewrite) {
        for (int index : rewrite.indexes(TokenType.KEYWORD_NAME)) {
            var text = rewrite.value(index);
            var result = new StringBuilder();
            int pos = 0;
            VariableMatch match;
            while ((match = VariableSearcher.search(text, pos)) != null) {
                result.append(text, pos, match.start());
                var base = match.base();
                int colon = base.indexOf(':');
                var name = colon < 0 ? base : base.substring(0, colon);
                var pattern = colon < 0 ? "" : base.substring(colon);
                var nameMatch = new VariableMatch(0, 0, match.identifier(), name, List.of());
                var defined = VariableRenamer.definedName(nameMatch);
                if (defined != null) {
                    locals.add(defined);
                }
                var renamed = renamer.renameVariable(nameMatch, blockCase);
                result.append(renamed, 0, renamed.length() - 1).append(pattern).append('}');
                pos = match.end();
            }
            result.append(text, pos, text.length());
            rewrite.set(index, result.toString());
        }
    }

    private void renameBlockSetting(Rewrite rewrite) {
        var statement = rewrite.statement;
        if (statement.getToken(TokenType.DOCUMENTATION) != null) {
            return;
        }
        if (statement.getToken(TokenType.TAGS) != null) {
            // tags are evaluated before the test runs, so they cannot see its locals
            rewrite.renameAll(unknownCase, TokenType.ARGUMENT);
            return;
        }
        if (statement.getToken(TokenType.ARGUMENTS) == null) {
            rewrite.renameAll(blockCase, TokenType.NAME, TokenType.ARGUMENT);
            return;
        }
        for (int index : rewrite.indexes(TokenType.ARGUMENT)) {
            var value = rewrite.value(index);
            var match = VariableSearcher.search(value, 0);
            if (match == null || match.start() != 0) {
                continue;
            }
            var rest = value.substring(match.end());
            // the default value is evaluated before the argument exists
            var defaultValue = rest.startsWith("=") ? "=" + renamer.renameText(rest.substring(1), blockCase) : rest;
            var defined = VariableRenamer.definedName(match);
            if (defined != null) {
                locals.add(defined);
            }
            rewrite.set(index, renamer.renameVariable(match, blockCase) + defaultValue);
        }
    }

    private void renameKeywordCall(Rewrite rewrite) {
        rewrite.renameAll(blockCase, TokenType.KEYWORD, TokenType.ARGUMENT);
        for (int index : rewrite.indexes(TokenType.ASSIGN)) {
            rewrite.define(index, true);
        }

        var keyword = rewrite.statement.getValue(TokenType.KEYWORD);
        var arguments = rewrite.indexes(TokenType.ARGUMENT);
        if (keyword == null || arguments.isEmpty()) {
            return;
        }
        var normalized = KeywordNames.normalize(keyword);
        if (PROMOTING_KEYWORDS.contains(normalized)) {
            rewrite.declareByName(arguments.get(0), false);
        } else if (normalized.equals(SET_LOCAL_VARIABLE)) {
            rewrite.declareByName(arguments.get(0), true);
        }
    }

    private void renameVar(Rewrite rewrite) {
        rewrite.renameAll(blockCase, TokenType.ARGUMENT, TokenType.OPTION);
        String scope = null;
        for (int index : rewrite.indexes(TokenType.OPTION)) {
            var option = rewrite.value(index);
            if (option.toLowerCase(Locale.ROOT).startsWith("scope=")) {
                scope = option.substring("scope=".length()).strip().toUpperCase(Locale.ROOT);
            }
        }
        boolean local = scope == null || scope.equals("LOCAL");
        for (int index : rewrite.indexes(TokenType.VARIABLE)) {
            rewrite.define(index, local);
        }
    }

    private void renameExcept(Rewrite rewrite) {
        var arguments = rewrite.indexes(TokenType.ARGUMENT);
        for (int i = 0; i < arguments.size(); i++) {
            int index = arguments.get(i);
            if (i > 0 && rewrite.value(arguments.get(i - 1)).equals("AS")) {
                rewrite.define(index, true);
            } else {
                rewrite.rename(index, blockCase);
            }
        }
    }

    /**
     * Token replacements for one statement, applied at the end unless the statement is disabled.
     */
    private final class Rewrite {
        final Statement statement;
        final boolean disabled;
        final List<Token> tokens;

        Rewrite(Statement statement, boolean disabled) {
            this.statement = statement;
            this.disabled = disabled;
            this.tokens = new ArrayList<>(statement.tokens());
        }

        List<Integer> indexes(TokenType type) {
            var result = new ArrayList<Integer>();
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).type() == type) {
                    result.add(i);
                }
            }
            return result;
        }

        String value(int index) {
            return tokens.get(index).value();
        }

        void set(int index, String value) {
            tokens.set(index, tokens.get(index).withValue(value));
        }

        void rename(int index, VariableRenamer.CaseResolver resolver) {
            set(index, renamer.renameText(value(index), resolver));
        }

        void renameAll(VariableRenamer.CaseResolver resolver, TokenType... types) {
            for (int i = 0; i < tokens.size(); i++) {
                var type = tokens.get(i).type();
                for (var candidate : types) {
                    if (type == candidate) {
                        rename(i, resolver);
                        break;
                    }
                }
            }
        }

        /**
         * Handles a variable being defined, e.g. {@code ${result}=} or the variable of {@code VAR}. Item assignments
         * like {@code ${dict}[key]=} change an existing variable and do not define one.
         */
        void define(int index, boolean local) {
            var value = value(index);
            var target = VariableSearcher.stripAssignMark(value);
            var match = VariableSearcher.matchWhole(target);
            if (match == null) {
                rename(index, blockCase);
                return;
            }
            var defined = VariableRenamer.definedName(match);
            if (defined != null && match.items().isEmpty()) {
                if (local) {
                    locals.add(defined);
                } else {
                    locals.remove(defined);
                }
            }
            set(index, renamer.renameVariable(match, blockCase) + value.substring(target.length()));
        }

        /**
         * The {@code Set ... Variable} keywords take the name as {@code ${name}}, {@code \${name}} or {@code $name}.
         */
        void declareByName(int index, boolean local) {
            var value = value(index);
            if (value.startsWith("\\")) {
                var match = VariableSearcher.matchWhole(value.substring(1));
                if (match != null) {
                    updateLocals(VariableRenamer.definedName(match), local);
                    set(index, "\\" + renamer.renameVariable(match, blockCase));
                }
            } else if (VariableSearcher.matchWhole(value) != null) {
                define(index, local);
            } else if (value.length() > 1 && "$@&".indexOf(value.charAt(0)) >= 0) {
                updateLocals(VariableNames.normalize(value.substring(1)), local);
            }
        }

        private void updateLocals(@Nullable String name, boolean local) {
            if (name == null) {
                return;
            }
            if (local) {
                locals.add(name);
            } else {
                locals.remove(name);
            }
        }

        void apply() {
            if (!disabled && !tokens.equals(statement.tokens())) {
                statement.setTokens(tokens);
            }
        }
    }
}
