package net.neoforged.tidy.api;

import java.nio.file.Path;

/**
 * Receives the non-fatal problems found while formatting: files that could not be read or written, and statements
 * or transformers that failed.
 * <p>
 * Implementations must be safe to call from several files being processed at once.
 */
@FunctionalInterface
public interface ProblemReporter {
    ProblemReporter NOOP = (problemId, severity, location, message) -> {
    };

    void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message);

    default void reportFileProblem(ProblemId problemId, ProblemSeverity severity, Path file, String message) {
        report(problemId, severity, ProblemLocation.ofFile(file), message);
    }
}
