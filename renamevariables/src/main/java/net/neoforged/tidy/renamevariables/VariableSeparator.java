package net.neoforged.tidy.renamevariables;

import java.util.regex.Pattern;

/**
 * How words of a variable name are separated.
 */
public enum VariableSeparator {
    UNDERSCORE,
    SPACE,
    /**
     * Keep spaces and underscores as written.
     */
    IGNORE;

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[ _]+");

    String apply(String name) {
        return switch (this) {
            case UNDERSCORE -> WORD_SEPARATORS.matcher(name).replaceAll("_");
            case SPACE -> WORD_SEPARATORS.matcher(name).replaceAll(" ");
            case IGNORE -> name;
        };
    }
}
