package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileSink;
import net.neoforged.tidy.api.FileSource;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

public final class FileSinks {
    /**
     * Used by {@code --check} and {@code --no-overwrite}: changes are counted but never written.
     */
    private static final FileSink DISCARD = (entry, content) -> {
    };

    private FileSinks() {
    }

    /**
     * @param output    the file given with {@code --output}, or {@code null} to write files in place
     * @param overwrite whether files are written at all
     */
    public static FileSink create(FileSource source, @Nullable Path output, boolean overwrite) {
        if (!overwrite) {
            return DISCARD;
        }
        if (output != null) {
            return new SingleFileSink(output, true);
        }
        if (source instanceof SingleFileSource single) {
            return new SingleFileSink(single.path(), false);
        } else if (source instanceof FolderFileSource folder) {
            return new FolderFileSink(folder.path());
        } else {
            throw new IllegalArgumentException("Cannot write back to source: " + source.getClass());
        }
    }
}
