package net.neoforged.tidy.api.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level section of a file.
 * <p>
 * Statements directly inside the section (settings, variables, comments, or anything preceding the first test or
 * keyword) are kept in {@link #body()}. Tests, tasks and keywords are kept in {@link #blocks()}.
 * The comments before the first section header form a section without a header.
 */
public final class Section {
    private final SectionType type;
    @Nullable
    private final Statement header;
    private final List<Statement> body;
    private final List<Block> blocks;

    public Section(SectionType type, @Nullable Statement header, List<Statement> body, List<Block> blocks) {
        this.type = type;
        this.header = header;
        this.body = new ArrayList<>(body);
        this.blocks = new ArrayList<>(blocks);
    }

    public SectionType type() {
        return type;
    }

    public @Nullable Statement header() {
        return header;
    }

    public boolean isImplicit() {
        return header == null;
    }

    public List<Statement> body() {
        return body;
    }

    public List<Block> blocks() {
        return blocks;
    }

    public List<Statement> statements() {
        var statements = new ArrayList<Statement>();
        if (header != null) {
            statements.add(header);
        }
        statements.addAll(body);
        for (var block : blocks) {
            statements.addAll(block.statements());
        }
        return statements;
    }

    public int lineNumber() {
        if (header != null) {
            return header.lineNumber();
        }
        if (!body.isEmpty()) {
            return body.get(0).lineNumber();
        }
        return blocks.isEmpty() ? Token.NO_POSITION : blocks.get(0).lineNumber();
    }

    public int endLineNumber() {
        int end = header == null ? Token.NO_POSITION : header.endLineNumber();
        for (var statement : body) {
            end = Math.max(end, statement.endLineNumber());
        }
        for (var block : blocks) {
            end = Math.max(end, block.endLineNumber());
        }
        return end;
    }
}
