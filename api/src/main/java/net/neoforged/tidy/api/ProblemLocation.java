package net.neoforged.tidy.api;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

public record ProblemLocation(Path file, @Nullable Integer line, @Nullable Integer column) {
    public static ProblemLocation ofFile(Path file) {
        return new ProblemLocation(file, null, null);
    }

    /**
     * @param line 1-based line number.
     */
    public static ProblemLocation ofLocationInFile(Path file, int line) {
        return new ProblemLocation(file, line, null);
    }

    /**
     * @param line   1-based line number.
     * @param column 1-based column number.
     */
    public static ProblemLocation ofLocationInFile(Path file, int line, int column) {
        return new ProblemLocation(file, line, column);
    }
}
