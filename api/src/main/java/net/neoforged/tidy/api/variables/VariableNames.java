package net.neoforged.tidy.api.variables;

import java.util.Locale;

public final class VariableNames {
    private VariableNames() {
    }

    /**
     * Normalizes a variable name for comparison. Robot Framework ignores case, spaces and underscores
     * when matching variable names.
     */
    public static String normalize(String name) {
        var builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c != ' ' && c != '_') {
                builder.append(c);
            }
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }
}
