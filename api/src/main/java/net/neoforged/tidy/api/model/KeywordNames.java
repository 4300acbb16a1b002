package net.neoforged.tidy.api.model;

import java.util.Locale;

public final class KeywordNames {
    private static final String BUILTIN_PREFIX = "builtin.";

    private KeywordNames() {
    }

    /**
     * Normalizes a keyword name for comparison: case, spaces and underscores are ignored, and the
     * {@code BuiltIn.} library prefix is dropped.
     */
    public static String normalize(String name) {
        var normalized = name.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "");
        if (normalized.startsWith(BUILTIN_PREFIX)) {
            normalized = normalized.substring(BUILTIN_PREFIX.length());
        }
        return normalized;
    }
}
