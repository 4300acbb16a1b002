package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.FileSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * @param writeUnchanged whether files are written even when formatting did not change them, used for {@code --output}
 */
record SingleFileSink(Path path, boolean writeUnchanged) implements FileSink {
    @Override
    public boolean acceptsUnchangedFiles() {
        return writeUnchanged;
    }

    @Override
    public void putFile(FileEntry entry, byte[] content) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content);
    }
}
