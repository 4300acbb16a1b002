package net.neoforged.tidy.splittoolongline;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.StatementVisitor;
import net.neoforged.tidy.api.TransformerId;
import net.neoforged.tidy.api.disablers.DisablerDirective;
import net.neoforged.tidy.api.model.Block;
import net.neoforged.tidy.api.model.KeywordNames;
import net.neoforged.tidy.api.model.Section;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.Token;
import net.neoforged.tidy.api.model.TokenType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites statements with a line over the limit into {@code ...} continuation lines.
 * <p>
 * The leading cells (assignments and keyword, {@code VAR} and its variable, or the variable name) always stay on the
 * first line. Arguments only ever move between lines, their order and text never change. Comments of a split statement
 * are moved above it, except {@code # robotidy:} directives which stay at the end of its last line.
 */
final class LineSplitter extends StatementVisitor {
    private static final String CONTINUATION = "...";

    private final SplitTooLongLineTransformer.SplitOptions options;
    private final String lineSeparator;
    private final String separator;
    private final String continuationSeparator;

    LineSplitter(FileContext context, SplitTooLongLineTransformer.SplitOptions options, String lineSeparator) {
        super(TransformerId.SPLIT_TOO_LONG_LINE, context);
        this.options = options;
        this.lineSeparator = lineSeparator;
        this.separator = context.config().separator();
        this.continuationSeparator = context.config().continuationSeparator();
    }

    @Override
    protected void visitStatement(Section section, @Nullable Block block, Statement statement) {
        int headSize = 0;
        boolean everyArg = false;
        switch (statement.type()) {
            case KEYWORD_CALL -> {
                var keyword = statement.getToken(TokenType.KEYWORD);
                if (keyword == null || options.skippedKeywords().contains(KeywordNames.normalize(keyword.value()))) {
                    return;
                }
                headSize = statement.getTokens(TokenType.ASSIGN).size() + 1;
                everyArg = options.splitOnEveryArg();
            }
            case VAR -> {
                headSize = statement.getToken(TokenType.VARIABLE) != null ? 2 : 1;
                everyArg = options.splitOnEveryValue();
            }
            case VARIABLE -> {
                headSize = 1;
                everyArg = options.splitOnEveryValue();
            }
            default -> {
                return;
            }
        }

        if (!isTooLong(statement) || isDisabled(statement)) {
            return;
        }
        var data = statement.dataTokens();
        if (data.size() <= headSize) {
            return;
        }

        var tokens = split(statement, data.subList(0, headSize), data.subList(headSize, data.size()), everyArg);
        if (!render(tokens).equals(statement.render())) {
            statement.setTokens(tokens);
        }
    }

    private boolean isTooLong(Statement statement) {
        for (var line : statement.lines()) {
            int length = 0;
            for (var token : line) {
                if (token.type() != TokenType.EOL) {
                    length += token.value().length();
                }
            }
            if (length > options.lineLength()) {
                return true;
            }
        }
        return false;
    }

    private List<Token> split(Statement statement, List<Token> head, List<Token> arguments, boolean everyArg) {
        var indent = statement.indent();
        var tokens = new ArrayList<Token>();

        var directives = new ArrayList<Token>();
        for (var comment : statement.getTokens(TokenType.COMMENT)) {
            // a directive only covers this statement while it trails it
            if (DisablerDirective.parse(comment.value()) != null) {
                directives.add(comment);
                continue;
            }
            addIndent(tokens, indent);
            tokens.add(comment);
            tokens.add(Token.of(TokenType.EOL, lineSeparator));
        }

        addIndent(tokens, indent);
        int length = indent.length();
        for (int i = 0; i < head.size(); i++) {
            if (i > 0) {
                tokens.add(Token.of(TokenType.SEPARATOR, separator));
                length += separator.length();
            }
            tokens.add(head.get(i));
            length += head.get(i).value().length();
        }

        for (var argument : arguments) {
            int appended = length + separator.length() + argument.value().length();
            if (!everyArg && appended <= options.lineLength()) {
                tokens.add(Token.of(TokenType.SEPARATOR, separator));
                tokens.add(argument);
                length = appended;
                continue;
            }
            tokens.add(Token.of(TokenType.EOL, lineSeparator));
            addIndent(tokens, indent);
            tokens.add(Token.of(TokenType.CONTINUATION, CONTINUATION));
            tokens.add(Token.of(TokenType.SEPARATOR, continuationSeparator));
            tokens.add(argument);
            length = indent.length() + CONTINUATION.length() + continuationSeparator.length() + argument.value().length();
        }

        for (var directive : directives) {
            tokens.add(Token.of(TokenType.SEPARATOR, separator));
            tokens.add(directive);
        }
        tokens.add(Token.of(TokenType.EOL, finalTerminator(statement)));
        return tokens;
    }

    private static void addIndent(List<Token> tokens, String indent) {
        if (!indent.isEmpty()) {
            tokens.add(Token.of(TokenType.SEPARATOR, indent));
        }
    }

    /**
     * The terminator of the last line, which is empty if the statement ends the file without a line break.
     */
    private static String finalTerminator(Statement statement) {
        var tokens = statement.tokens();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            var token = tokens.get(i);
            if (token.type() == TokenType.EOL) {
                return token.value().replace(" ", "").replace("\t", "");
            }
        }
        return "";
    }

    private static String render(List<Token> tokens) {
        var builder = new StringBuilder();
        for (var token : tokens) {
            builder.append(token.value());
        }
        return builder.toString();
    }
}
