package net.neoforged.tidy.api;

public enum ProblemSeverity {
    /**
     * The affected statement or file was left as it was, the run continues.
     */
    WARNING,
    /**
     * The affected file could not be processed.
     */
    ERROR
}
