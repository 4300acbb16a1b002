package net.neoforged.tidy.api.parsing;

import net.neoforged.tidy.api.model.SourceTree;

public final class RobotRenderer {
    private RobotRenderer() {
    }

    /**
     * Serializes a tree back to text. Tokens are written exactly as they are, so anything a transformer did not
     * replace comes out as it was read.
     */
    public static String render(SourceTree tree) {
        var builder = new StringBuilder();
        for (var statement : tree.statements()) {
            for (var token : statement.tokens()) {
                builder.append(token.value());
            }
        }
        return builder.toString();
    }
}
