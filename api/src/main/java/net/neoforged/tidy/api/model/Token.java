package net.neoforged.tidy.api.model;

import java.util.Objects;

/**
 * Atomic lexical unit of a source file.
 * <p>
 * Tokens are immutable. Transformers that want to change the text of a token create a new one,
 * usually through {@link #withValue(String)} so the source position is retained.
 *
 * @param type         the kind of token
 * @param value        the raw text, exactly as it appears in the source
 * @param lineNumber   1-based line of the first character, or {@link #NO_POSITION} for created tokens
 * @param columnOffset 0-based column of the first character, or {@link #NO_POSITION} for created tokens
 */
public record Token(TokenType type, String value, int lineNumber, int columnOffset) {
    public static final int NO_POSITION = -1;

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public static Token of(TokenType type, String value) {
        return new Token(type, value, NO_POSITION, NO_POSITION);
    }

    public Token withValue(String value) {
        return new Token(type, value, lineNumber, columnOffset);
    }

    public Token withType(TokenType type) {
        return new Token(type, value, lineNumber, columnOffset);
    }

    public boolean hasPosition() {
        return lineNumber != NO_POSITION;
    }

    public int endColumnOffset() {
        return columnOffset + value.length();
    }

    @Override
    public String toString() {
        return type + "(" + value.replace("\n", "\\n").replace("\r", "\\r") + ")";
    }
}
