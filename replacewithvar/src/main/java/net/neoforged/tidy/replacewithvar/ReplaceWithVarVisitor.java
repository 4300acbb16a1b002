package net.neoforged.tidy.replacewithvar;

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
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class ReplaceWithVarVisitor extends StatementVisitor {
    private final VarConverter converter;
    private final Set<LegacyKeyword> skipped;
    private final String separator;

    ReplaceWithVarVisitor(FileContext context, VarConverter converter, Set<LegacyKeyword> skipped, String separator) {
        super(TransformerId.REPLACE_WITH_VAR, context);
        this.converter = converter;
        this.skipped = skipped;
        this.separator = separator;
    }

    @Override
    protected void visitStatement(Section section, @Nullable Block block, Statement statement) {
        if (block == null || statement.type() != StatementType.KEYWORD_CALL) {
            return;
        }
        var keywordToken = statement.getToken(TokenType.KEYWORD);
        if (keywordToken == null) {
            return;
        }
        var keyword = LegacyKeyword.byName(KeywordNames.normalize(keywordToken.value()));
        if (keyword == null || skipped.contains(keyword) || isDisabled(statement)) {
            return;
        }

        var assigns = values(statement.getTokens(TokenType.ASSIGN));
        var arguments = values(statement.getTokens(TokenType.ARGUMENT));
        var form = converter.convert(keyword, assigns, arguments);
        if (form == null) {
            context.logger().debug("%s:%d: %s left as is", context.file(), statement.lineNumber(), keywordToken.value());
            return;
        }

        int index = block.body().indexOf(statement);
        block.body().set(index, toStatement(statement, form));
    }

    private Statement toStatement(Statement original, VarForm form) {
        var tokens = new ArrayList<Token>();
        var indent = original.indent();
        if (!indent.isEmpty()) {
            tokens.add(original.tokens().get(0));
        }
        tokens.add(new Token(TokenType.VAR, "VAR", original.lineNumber(), indent.length()));
        addCell(tokens, TokenType.VARIABLE, form.variable());
        for (var value : form.values()) {
            addCell(tokens, TokenType.ARGUMENT, value);
        }
        for (var option : form.options()) {
            addCell(tokens, TokenType.OPTION, option);
        }
        for (var comment : original.getTokens(TokenType.COMMENT)) {
            tokens.add(Token.of(TokenType.SEPARATOR, separator));
            tokens.add(comment);
        }
        var terminator = original.tokens().get(original.tokens().size() - 1);
        tokens.add(Token.of(TokenType.EOL, terminator.type() == TokenType.EOL ? lineBreak(terminator.value()) : ""));
        return new Statement(StatementType.VAR, tokens);
    }

    private void addCell(List<Token> tokens, TokenType type, String value) {
        tokens.add(Token.of(TokenType.SEPARATOR, separator));
        tokens.add(Token.of(type, value));
    }

    private static String lineBreak(String eol) {
        int start = 0;
        while (start < eol.length() && eol.charAt(start) != '\r' && eol.charAt(start) != '\n') {
            start++;
        }
        return eol.substring(start);
    }

    private static List<String> values(List<Token> tokens) {
        var values = new ArrayList<String>(tokens.size());
        for (var token : tokens) {
            values.add(token.value());
        }
        return values;
    }
}
