package net.neoforged.tidy.cli.io;

import net.neoforged.tidy.api.FileSource;
import org.jetbrains.annotations.Nullable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

public final class FileSources {
    private FileSources() {
    }

    /**
     * Creates the source for a path given on the command line. Files are taken as they are, folders are searched for
     * {@code .robot} and {@code .resource} files.
     *
     * @param exclude        paths matching this pattern are not searched
     * @param extendExclude  additional pattern of excluded paths, or {@code null}
     */
    public static FileSource create(Path path, Pattern exclude, @Nullable Pattern extendExclude) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File does not exist: " + path);
        }

        if (Files.isDirectory(path)) {
            return new FolderFileSource(path, exclude, extendExclude);
        } else if (Files.isRegularFile(path)) {
            return new SingleFileSource(path);
        } else {
            throw new IOException("Cannot detect type of " + path + " it is neither file nor folder.");
        }
    }
}
