package net.neoforged.tidy.renamevariables;

import java.util.Locale;

public enum NameCase {
    UPPER,
    LOWER,
    /**
     * Keep the case as written.
     */
    IGNORE;

    String apply(String name) {
        return switch (this) {
            case UPPER -> name.toUpperCase(Locale.ROOT);
            case LOWER -> name.toLowerCase(Locale.ROOT);
            case IGNORE -> name;
        };
    }
}
