package net.neoforged.tidy.cli;

public enum FileOutcome {
    REFORMATTED,
    UNCHANGED,
    /**
     * All transformers are disabled on the whole file. Reported as unchanged.
     */
    DISABLED,
    /**
     * The file could not be read, decoded or written.
     */
    SKIPPED
}
