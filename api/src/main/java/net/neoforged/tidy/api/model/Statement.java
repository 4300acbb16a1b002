package net.neoforged.tidy.api.model;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * One logical line of source: a keyword call, a setting, a {@code VAR} declaration and so on,
 * including any {@code ...} continuation lines.
 * <p>
 * The line span of a statement is fixed when it is parsed. Transformers replace the tokens
 * through {@link #setTokens(List)}, but the statement keeps reporting its original position
 * so that disabled ranges keep applying to it.
 */
public final class Statement {
    private final StatementType type;
    private final int lineNumber;
    private final int endLineNumber;
    private List<Token> tokens;

    public Statement(StatementType type, List<Token> tokens) {
        this.type = Objects.requireNonNull(type, "type");
        this.tokens = List.copyOf(tokens);
        int first = Token.NO_POSITION;
        int last = Token.NO_POSITION;
        for (var token : this.tokens) {
            if (!token.hasPosition()) {
                continue;
            }
            if (first == Token.NO_POSITION) {
                first = token.lineNumber();
            }
            last = Math.max(last, token.lineNumber());
        }
        this.lineNumber = first;
        this.endLineNumber = last;
    }

    public StatementType type() {
        return type;
    }

    /**
     * @return 1-based line the statement started on in the parsed source
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * @return 1-based last line the statement spanned in the parsed source
     */
    public int endLineNumber() {
        return endLineNumber;
    }

    @UnmodifiableView
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * Replaces all tokens of this statement. The given tokens must be in source order.
     */
    public void setTokens(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public @Nullable Token getToken(TokenType type) {
        for (var token : tokens) {
            if (token.type() == type) {
                return token;
            }
        }
        return null;
    }

    public List<Token> getTokens(TokenType first, TokenType... rest) {
        var types = EnumSet.of(first, rest);
        var result = new ArrayList<Token>();
        for (var token : tokens) {
            if (types.contains(token.type())) {
                result.add(token);
            }
        }
        return result;
    }

    public @Nullable String getValue(TokenType type) {
        var token = getToken(type);
        return token == null ? null : token.value();
    }

    /**
     * @return the data tokens, i.e. everything but separators, comments, continuation markers and line ends
     */
    public List<Token> dataTokens() {
        var result = new ArrayList<Token>();
        for (var token : tokens) {
            if (token.type().isData()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Splits the tokens into physical lines. Each line but possibly the last one ends with an {@link TokenType#EOL} token.
     */
    public List<List<Token>> lines() {
        var lines = new ArrayList<List<Token>>();
        var current = new ArrayList<Token>();
        for (var token : tokens) {
            current.add(token);
            if (token.type() == TokenType.EOL) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    /**
     * @return the leading whitespace of the statement, or an empty string if it starts at column 0
     */
    public String indent() {
        if (!tokens.isEmpty() && tokens.get(0).type() == TokenType.SEPARATOR) {
            return tokens.get(0).value();
        }
        return "";
    }

    /**
     * @return whether the first non-whitespace token of the statement is at the start of its line
     */
    public boolean isLineStart() {
        for (var token : tokens) {
            if (token.type() == TokenType.SEPARATOR) {
                continue;
            }
            return token.columnOffset() == 0;
        }
        return false;
    }

    /**
     * @return the line terminator of the first line, without any trailing whitespace, or {@code null} if the
     * statement ends the file without one
     */
    public @Nullable String lineTerminator() {
        for (var token : tokens) {
            if (token.type() == TokenType.EOL) {
                var value = token.value();
                int i = 0;
                while (i < value.length() && value.charAt(i) != '\r' && value.charAt(i) != '\n') {
                    i++;
                }
                return i == value.length() ? null : value.substring(i);
            }
        }
        return null;
    }

    public String render() {
        var builder = new StringBuilder();
        for (var token : tokens) {
            builder.append(token.value());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return type + "@" + lineNumber + Collections.unmodifiableList(tokens);
    }
}
