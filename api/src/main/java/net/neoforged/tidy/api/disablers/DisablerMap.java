package net.neoforged.tidy.api.disablers;

import net.neoforged.tidy.api.TransformerId;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.Token;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The disabled line ranges of one file, per transformer.
 * <p>
 * Built once by {@link DisablerResolver} before any transformer runs and never changed afterwards.
 */
public final class DisablerMap {
    public static final DisablerMap EMPTY = new DisablerMap(Map.of());

    private final Map<String, DisabledLines> disablers;

    DisablerMap(Map<String, DisabledLines> disablers) {
        this.disablers = new HashMap<>(disablers);
    }

    /**
     * @return whether the given line is inside a range disabling the transformer
     */
    public boolean isDisabled(TransformerId transformer, int line) {
        return isDisabled(transformer, line, line);
    }

    /**
     * @return whether the whole span from {@code startLine} to {@code endLine} is inside one range disabling the
     * transformer
     */
    public boolean isDisabled(TransformerId transformer, int startLine, int endLine) {
        return isDisabled(DisablerDirective.ALL, startLine, endLine) || isDisabled(transformer.getName(), startLine, endLine);
    }

    /**
     * Statements created by a transformer have no position and are never disabled.
     */
    public boolean isDisabled(TransformerId transformer, Statement statement) {
        if (statement.lineNumber() == Token.NO_POSITION) {
            return false;
        }
        return isDisabled(transformer, statement.lineNumber(), statement.endLineNumber());
    }

    private boolean isDisabled(String target, int startLine, int endLine) {
        var lines = disablers.get(target);
        return lines != null && lines.isDisabled(startLine, endLine);
    }

    public boolean isDisabledInFile(TransformerId transformer) {
        return isDisabledInFile() || isWholeFile(transformer.getName());
    }

    /**
     * @return whether every transformer is disabled on the whole file
     */
    public boolean isDisabledInFile() {
        return isWholeFile(DisablerDirective.ALL);
    }

    private boolean isWholeFile(String target) {
        var lines = disablers.get(target);
        return lines != null && lines.isWholeFile();
    }

    /**
     * @return names used in directives of this file that match no transformer; they never disable anything
     */
    public Set<String> inertNames() {
        var result = new TreeSet<String>();
        for (var name : disablers.keySet()) {
            if (!name.equals(DisablerDirective.ALL) && TransformerId.byName(name).isEmpty()) {
                result.add(name);
            }
        }
        return result;
    }
}
