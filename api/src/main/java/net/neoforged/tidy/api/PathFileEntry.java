package net.neoforged.tidy.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

final class PathFileEntry implements FileEntry {
    private final Path path;
    private final String relativePath;

    public PathFileEntry(Path relativeTo, Path path) {
        this.path = path;
        var relativized = relativeTo.relativize(path).toString();
        relativized = relativized.replace('\\', '/');
        this.relativePath = relativized;
    }

    PathFileEntry(Path path) {
        this.path = path;
        this.relativePath = path.toString().replace('\\', '/');
    }

    @Override
    public String relativePath() {
        return relativePath;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public InputStream openInputStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
