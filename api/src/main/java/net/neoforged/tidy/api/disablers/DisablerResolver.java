package net.neoforged.tidy.api.disablers;

import net.neoforged.tidy.api.model.Block;
import net.neoforged.tidy.api.model.Section;
import net.neoforged.tidy.api.model.SectionType;
import net.neoforged.tidy.api.model.SourceTree;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.StatementType;
import net.neoforged.tidy.api.model.TokenType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans the comments of a file for {@code # robotidy:} directives and computes the disabled ranges.
 * <p>
 * Sections, tests, tasks, keywords and the bodies of {@code FOR}, {@code WHILE}, {@code IF} and {@code TRY}
 * structures are scopes: an {@code off} directive inside a scope lasts until a matching {@code on} in the same scope,
 * or until the scope ends. A standalone directive starting at column 0 belongs to the section scope. An unclosed
 * {@code off} in the comments before the first section header applies to the whole file.
 */
public final class DisablerResolver {
    @Nullable
    private final Integer startLine;
    @Nullable
    private final Integer endLine;

    private final Map<String, DisabledLines> disablers = new HashMap<>();
    private final List<Map<String, Integer>> scopes = new ArrayList<>();
    private final Deque<ControlFrame> controlFrames = new ArrayDeque<>();
    private boolean fileLevel;

    /**
     * @param startLine first line to format, everything before is disabled; {@code null} to format from the start
     * @param endLine   last line to format, everything after is disabled; defaults to {@code startLine}
     */
    public DisablerResolver(@Nullable Integer startLine, @Nullable Integer endLine) {
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public DisablerResolver() {
        this(null, null);
    }

    /**
     * A resolver instance can be reused, but not concurrently.
     */
    public synchronized DisablerMap resolve(SourceTree tree) {
        disablers.clear();
        scopes.clear();
        controlFrames.clear();
        disablers.put(DisablerDirective.ALL, new DisabledLines());
        addLineWindow(tree.endLineNumber());

        var sections = tree.sections();
        for (int i = 0; i < sections.size(); i++) {
            var section = sections.get(i);
            fileLevel = i == 0 && section.type() == SectionType.COMMENTS;
            visitSection(section);
        }
        for (var lines : disablers.values()) {
            lines.sort();
        }
        return new DisablerMap(disablers);
    }

    private void addLineWindow(int fileEnd) {
        if (startLine == null) {
            return;
        }
        int end = endLine != null ? endLine : startLine;
        if (startLine > 1) {
            add(DisablerDirective.ALL, 1, startLine - 1, false);
        }
        if (end < fileEnd) {
            add(DisablerDirective.ALL, end + 1, fileEnd, false);
        }
    }

    private void visitSection(Section section) {
        openScope();
        var header = section.header();
        if (header != null) {
            var directive = inlineDirective(header);
            if (directive != null && directive.off()) {
                for (var target : directive.targets()) {
                    add(target, section.lineNumber(), section.endLineNumber(), false);
                }
            }
        }
        for (var statement : section.body()) {
            visitStatement(statement);
        }
        for (var block : section.blocks()) {
            visitBlock(block);
        }
        closeScope(section.endLineNumber());
    }

    private void visitBlock(Block block) {
        openScope();
        visitStatement(block.header());
        for (var statement : block.body()) {
            visitControlStructure(statement);
            visitStatement(statement);
        }
        // unterminated structures end with their block
        while (!controlFrames.isEmpty()) {
            var frame = controlFrames.pop();
            for (int i = 0; i < frame.scopes; i++) {
                closeScope(block.endLineNumber());
            }
        }
        closeScope(block.endLineNumber());
    }

    private void visitControlStructure(Statement statement) {
        var frame = controlFrames.peek();
        switch (statement.type()) {
            case FOR_HEADER, WHILE_HEADER, TRY_HEADER -> {
                controlFrames.push(new ControlFrame(statement.type() == StatementType.TRY_HEADER));
                openScope();
            }
            case IF_HEADER -> {
                // inline IF has no END
                if (statement.dataTokens().size() <= 2) {
                    controlFrames.push(new ControlFrame(false));
                    openScope();
                }
            }
            case ELSE_IF_HEADER, ELSE_HEADER, EXCEPT_HEADER, FINALLY_HEADER -> {
                if (frame == null) {
                    return;
                }
                if (frame.isTry) {
                    // each TRY branch is its own scope
                    closeScope(statement.lineNumber() - 1);
                    openScope();
                } else {
                    // ELSE branches nest inside the IF, so an unclosed disabler lasts until END
                    frame.scopes++;
                    openScope();
                }
            }
            case END -> {
                if (frame == null) {
                    return;
                }
                controlFrames.pop();
                for (int i = 0; i < frame.scopes; i++) {
                    closeScope(statement.lineNumber());
                }
            }
            default -> {
            }
        }
    }

    private void visitStatement(Statement statement) {
        if (statement.type() == StatementType.COMMENT) {
            var directive = DisablerDirective.parse(statement.getValue(TokenType.COMMENT));
            if (directive == null) {
                return;
            }
            var scope = statement.isLineStart() ? scopes.get(0) : scopes.get(scopes.size() - 1);
            for (var target : directive.targets()) {
                Integer openedAt = scope.get(target);
                if (!directive.off()) {
                    if (openedAt != null) {
                        add(target, openedAt, statement.lineNumber(), false);
                        scope.remove(target);
                    }
                } else if (openedAt == null) {
                    scope.put(target, statement.lineNumber());
                }
            }
            return;
        }

        for (var comment : statement.getTokens(TokenType.COMMENT)) {
            var directive = DisablerDirective.parse(comment.value());
            if (directive != null && directive.off()) {
                for (var target : directive.targets()) {
                    add(target, statement.lineNumber(), statement.endLineNumber(), false);
                }
            }
        }
    }

    private static @Nullable DisablerDirective inlineDirective(Statement statement) {
        for (var comment : statement.getTokens(TokenType.COMMENT)) {
            var directive = DisablerDirective.parse(comment.value());
            if (directive != null) {
                return directive;
            }
        }
        return null;
    }

    private void openScope() {
        scopes.add(new LinkedHashMap<>());
    }

    private void closeScope(int endLine) {
        var scope = scopes.remove(scopes.size() - 1);
        for (var entry : scope.entrySet()) {
            add(entry.getKey(), entry.getValue(), endLine, fileLevel);
        }
    }

    private void add(String target, int startLine, int endLine, boolean wholeFile) {
        var lines = disablers.computeIfAbsent(target, t -> new DisabledLines());
        lines.add(startLine, endLine);
        if (wholeFile) {
            lines.disableWholeFile();
        }
    }

    private static final class ControlFrame {
        final boolean isTry;
        int scopes = 1;

        ControlFrame(boolean isTry) {
            this.isTry = isTry;
        }
    }
}
