package net.neoforged.tidy.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A test case, task or user keyword: the statement holding its name followed by its body.
 */
public final class Block {
    private final BlockType type;
    private final Statement header;
    private final List<Statement> body;

    public Block(BlockType type, Statement header, List<Statement> body) {
        this.type = type;
        this.header = header;
        this.body = new ArrayList<>(body);
    }

    public BlockType type() {
        return type;
    }

    public Statement header() {
        return header;
    }

    public String name() {
        var name = header.getValue(type == BlockType.KEYWORD ? TokenType.KEYWORD_NAME : TokenType.TESTCASE_NAME);
        return name == null ? "" : name;
    }

    /**
     * Body statements in source order. The list can be modified to insert or remove statements.
     */
    public List<Statement> body() {
        return body;
    }

    public List<Statement> statements() {
        var statements = new ArrayList<Statement>(body.size() + 1);
        statements.add(header);
        statements.addAll(body);
        return statements;
    }

    public int lineNumber() {
        return header.lineNumber();
    }

    public int endLineNumber() {
        int end = header.endLineNumber();
        for (var statement : body) {
            end = Math.max(end, statement.endLineNumber());
        }
        return end;
    }
}
