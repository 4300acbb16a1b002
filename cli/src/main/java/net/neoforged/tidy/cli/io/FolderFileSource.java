package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileEntries;
import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.FileSource;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

record FolderFileSource(Path path, Pattern exclude, @Nullable Pattern extendExclude) implements FileSource {
    private static final List<String> EXTENSIONS = List.of("robot", "resource");

    @Override
    public Stream<FileEntry> streamEntries() throws IOException {
        // sorted, so files are always processed and reported in the same order
        return Files.walk(path)
                .filter(p -> !p.equals(path))
                .filter(p -> !isExcluded(path.relativize(p)))
                .filter(Files::isRegularFile)
                .sorted()
                .map(child -> FileEntries.ofPath(path, child))
                .filter(FolderFileSource::isRobotFile);
    }

    private boolean isExcluded(Path relativePath) {
        var text = relativePath.toString().replace('\\', '/');
        return exclude.matcher(text).find() || (extendExclude != null && extendExclude.matcher(text).find());
    }

    private static boolean isRobotFile(FileEntry entry) {
        for (var extension : EXTENSIONS) {
            if (entry.hasExtension(extension)) {
                return true;
            }
        }
        return false;
    }
}
