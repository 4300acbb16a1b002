package net.neoforged.tidy.cli;

import net.neoforged.tidy.api.FileEntry;
import org.jetbrains.annotations.Nullable;

/**
 * @param content the formatted content of the file, or {@code null} if it was skipped
 */
record FileResult(FileEntry entry, FileOutcome outcome, @Nullable byte[] content) {
    static FileResult of(FileEntry entry, FileOutcome outcome) {
        return new FileResult(entry, outcome, null);
    }
}
