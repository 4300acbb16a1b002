package net.neoforged.tidy.api;

public enum LineEnding {
    /**
     * The separator of the platform the formatter runs on.
     */
    NATIVE,
    WINDOWS,
    UNIX,
    /**
     * Whatever the first line of the file uses, or the platform separator if the file has only one line.
     */
    AUTO
}
