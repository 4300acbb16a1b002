package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileEntries;
import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.FileSource;

import java.nio.file.Path;
import java.util.stream.Stream;

record SingleFileSource(Path path) implements FileSource {
    @Override
    public Stream<FileEntry> streamEntries() {
        return Stream.of(FileEntries.ofFile(path));
    }
}
