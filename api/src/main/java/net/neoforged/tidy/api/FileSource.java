package net.neoforged.tidy.api;

import java.io.IOException;
import java.util.stream.Stream;

public interface FileSource extends AutoCloseable {
    /**
     * The entries to format, in a stable order.
     */
    Stream<FileEntry> streamEntries() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
