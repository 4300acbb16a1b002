package net.neoforged.tidy.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;

public interface FileEntry {
    /**
     * Path to the file, relative to the source root. Uses forward slashes as path-separators, and does not have a
     * leading slash. For a single file given on the command line it is the path as given.
     */
    String relativePath();

    /**
     * The location of the file on disk, used to report problems.
     */
    Path path();

    /**
     * @return An input stream to read this content.
     */
    InputStream openInputStream() throws IOException;

    default boolean hasExtension(String extension) {
        return relativePath().toLowerCase(Locale.ROOT).endsWith("." + extension.toLowerCase(Locale.ROOT));
    }
}
