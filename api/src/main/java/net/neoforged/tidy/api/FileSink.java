package net.neoforged.tidy.api;

import java.io.IOException;

public interface FileSink extends AutoCloseable {
    @Override
    default void close() throws IOException {
    }

    /**
     * @return whether files that formatting left unchanged are written too
     */
    default boolean acceptsUnchangedFiles() {
        return false;
    }

    /**
     * Writes the formatted content of a file.
     */
    void putFile(FileEntry entry, byte[] content) throws IOException;
}
