package net.neoforged.tidy.api;

import net.neoforged.tidy.api.model.Block;
import net.neoforged.tidy.api.model.Section;
import net.neoforged.tidy.api.model.SourceTree;
import net.neoforged.tidy.api.model.Statement;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Walks all statements of a tree in source order. A visitor is created per file and transformer.
 * <p>
 * An exception thrown while visiting one statement is reported as a warning and the walk continues with the next
 * statement, so a single statement a transformer cannot handle never costs the rest of the file.
 */
public abstract class StatementVisitor {
    protected final TransformerId transformer;
    protected final FileContext context;

    protected StatementVisitor(TransformerId transformer, FileContext context) {
        this.transformer = transformer;
        this.context = context;
    }

    public void visitFile(SourceTree tree) {
        for (var section : tree.sections()) {
            visitSection(section);
        }
    }

    protected void visitSection(Section section) {
        if (section.header() != null) {
            safeVisit(section, null, section.header());
        }
        visitStatements(section, null, section.body());
        for (var block : section.blocks()) {
            visitBlock(section, block);
        }
    }

    protected void visitBlock(Section section, Block block) {
        safeVisit(section, block, block.header());
        visitStatements(section, block, block.body());
    }

    private void visitStatements(Section section, @Nullable Block block, List<Statement> statements) {
        // statements may be added or removed while iterating
        for (int i = 0; i < statements.size(); i++) {
            var statement = statements.get(i);
            safeVisit(section, block, statement);
            int index = statements.indexOf(statement);
            // a replaced statement is gone from the list, its replacement takes its index
            i = index < 0 ? i - 1 : index;
        }
    }

    private void safeVisit(Section section, @Nullable Block block, Statement statement) {
        try {
            visitStatement(section, block, statement);
        } catch (RuntimeException e) {
            context.problemReporter().report(TidyProblems.MALFORMED_STATEMENT, ProblemSeverity.WARNING,
                    context.location(statement), transformer + " skipped a statement: " + e);
            context.logger().debug("%s skipped statement at %s:%d: %s", transformer, context.file(), statement.lineNumber(), e);
        }
    }

    /**
     * @param block the test, task or keyword containing the statement, or {@code null} for statements directly inside
     *              a section
     */
    protected abstract void visitStatement(Section section, @Nullable Block block, Statement statement);

    protected boolean isDisabled(Statement statement) {
        return context.disablers().isDisabled(transformer, statement);
    }
}
