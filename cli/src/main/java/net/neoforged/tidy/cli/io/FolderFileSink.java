package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.FileSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

record FolderFileSink(Path path) implements FileSink {
    @Override
    public void putFile(FileEntry entry, byte[] content) throws IOException {
        Files.write(path.resolve(entry.relativePath()), content);
    }
}
