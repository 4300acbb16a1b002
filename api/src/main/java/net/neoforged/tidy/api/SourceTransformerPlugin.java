package net.neoforged.tidy.api;

/**
 * Accessed via {@link java.util.ServiceLoader}.
 */
public interface SourceTransformerPlugin {

    /**
     * The transformer this plugin provides.
     */
    TransformerId getId();

    /**
     * Unique name used in command-line options to enable this plugin.
     */
    default String getName() {
        return getId().getName();
    }

    /**
     * Short description shown by {@code --list} and {@code --desc}.
     */
    String getDescription();

    /**
     * Creates a new transformer to be applied to source code.
     */
    SourceTransformer createTransformer();

}
