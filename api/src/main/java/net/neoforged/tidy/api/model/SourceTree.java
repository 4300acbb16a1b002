package net.neoforged.tidy.api.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed representation of one source file.
 * <p>
 * A tree is owned by the pipeline processing its file: transformers mutate it in place and must not keep a reference
 * to it, or to any of its statements, once they return.
 */
public final class SourceTree {
    private final List<Section> sections;
    @Nullable
    private final String lineSeparator;

    public SourceTree(List<Section> sections, @Nullable String lineSeparator) {
        this.sections = new ArrayList<>(sections);
        this.lineSeparator = lineSeparator;
    }

    public List<Section> sections() {
        return sections;
    }

    /**
     * @return the line terminator of the first line in the file, or {@code null} for files without one
     */
    public @Nullable String lineSeparator() {
        return lineSeparator;
    }

    public List<Statement> statements() {
        var statements = new ArrayList<Statement>();
        for (var section : sections) {
            statements.addAll(section.statements());
        }
        return statements;
    }

    public int endLineNumber() {
        int end = 0;
        for (var section : sections) {
            end = Math.max(end, section.endLineNumber());
        }
        return end;
    }
}
