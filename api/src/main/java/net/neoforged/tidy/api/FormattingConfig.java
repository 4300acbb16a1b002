package net.neoforged.tidy.api;

import net.neoforged.tidy.api.model.SourceTree;
import org.jetbrains.annotations.Nullable;

/**
 * Global layout settings shared by all transformers.
 *
 * @param spaceCount         number of spaces between cells
 * @param continuationIndent number of spaces between {@code ...} and the first cell of a continuation line
 * @param separatorStyle     whether cells are separated by spaces or by a tab
 * @param lineLength         maximum length of a line, line terminator excluded
 * @param lineEnding         the line separator used for lines created by transformers
 * @param startLine          first line to format, or {@code null} to format from the start of the file
 * @param endLine            last line to format, or {@code null}
 */
public record FormattingConfig(int spaceCount,
                               int continuationIndent,
                               SeparatorStyle separatorStyle,
                               int lineLength,
                               LineEnding lineEnding,
                               @Nullable Integer startLine,
                               @Nullable Integer endLine) {
    public static final FormattingConfig DEFAULT = new FormattingConfig(4, 4, SeparatorStyle.SPACE, 120, LineEnding.AUTO, null, null);

    public FormattingConfig {
        if (spaceCount < 2) {
            throw new IllegalArgumentException("spacecount must be at least 2, was " + spaceCount);
        }
        if (continuationIndent < 1) {
            throw new IllegalArgumentException("continuation indent must be positive, was " + continuationIndent);
        }
        if (lineLength < 1) {
            throw new IllegalArgumentException("line length must be positive, was " + lineLength);
        }
        if (startLine != null && startLine < 1) {
            throw new IllegalArgumentException("startline must be positive, was " + startLine);
        }
        if (startLine != null && endLine != null && endLine < startLine) {
            throw new IllegalArgumentException("endline " + endLine + " is before startline " + startLine);
        }
    }

    /**
     * @return the whitespace written between two cells
     */
    public String separator() {
        return separatorStyle == SeparatorStyle.TAB ? "\t" : " ".repeat(spaceCount);
    }

    /**
     * @return the whitespace written between {@code ...} and the first cell of a continuation line
     */
    public String continuationSeparator() {
        return separatorStyle == SeparatorStyle.TAB ? "\t" : " ".repeat(continuationIndent);
    }

    public String lineSeparator(SourceTree tree) {
        return switch (lineEnding) {
            case WINDOWS -> "\r\n";
            case UNIX -> "\n";
            case NATIVE -> System.lineSeparator();
            case AUTO -> tree.lineSeparator() != null ? tree.lineSeparator() : System.lineSeparator();
        };
    }

    public FormattingConfig withLineLength(int lineLength) {
        return new FormattingConfig(spaceCount, continuationIndent, separatorStyle, lineLength, lineEnding, startLine, endLine);
    }
}
