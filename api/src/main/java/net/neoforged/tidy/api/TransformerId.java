package net.neoforged.tidy.api;

import java.util.Optional;

/**
 * The closed set of transformers. Declaration order is the order they run in, unless the user forces another one.
 */
public enum TransformerId {
    REPLACE_WITH_VAR("ReplaceWithVAR", false),
    RENAME_VARIABLES("RenameVariables", false),
    SPLIT_TOO_LONG_LINE("SplitTooLongLine", true);

    private final String name;
    private final boolean enabledByDefault;

    TransformerId(String name, boolean enabledByDefault) {
        this.name = name;
        this.enabledByDefault = enabledByDefault;
    }

    /**
     * The name used on the command line and in {@code # robotidy: off=} directives.
     */
    public String getName() {
        return name;
    }

    public boolean isEnabledByDefault() {
        return enabledByDefault;
    }

    /**
     * Looks up a transformer by its exact name.
     */
    public static Optional<TransformerId> byName(String name) {
        for (var id : values()) {
            if (id.name.equals(name)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
