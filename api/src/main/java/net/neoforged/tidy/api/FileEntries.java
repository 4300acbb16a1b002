package net.neoforged.tidy.api;

import java.nio.file.Path;

public final class FileEntries {
    private FileEntries() {
    }

    /**
     * Creates an entry for a file found while walking a folder. The relative path of the entry, which exclude
     * patterns are matched against, is its path inside {@code folder}.
     */
    public static FileEntry ofPath(Path folder, Path path) {
        if (path.equals(folder) || !path.startsWith(folder)) {
            throw new IllegalArgumentException(path + " is not a file inside " + folder);
        }
        return new PathFileEntry(folder, path);
    }

    /**
     * Creates an entry for a file given directly on the command line, which keeps its path as given.
     */
    public static FileEntry ofFile(Path path) {
        return new PathFileEntry(path);
    }
}
