package net.neoforged.tidy.api;

import net.neoforged.tidy.api.disablers.DisablerMap;
import net.neoforged.tidy.api.model.Statement;
import net.neoforged.tidy.api.model.Token;

import java.nio.file.Path;

/**
 * Everything a transformer knows about the file it is visiting.
 *
 * @param file      the path of the file, relative to its source root
 * @param disablers the disabled ranges of the file
 */
public record FileContext(Path file, DisablerMap disablers, FormattingConfig config, Logger logger, ProblemReporter problemReporter) {
    public static FileContext of(Path file, FormattingConfig config) {
        return new FileContext(file, DisablerMap.EMPTY, config, new Logger(null, null, null), ProblemReporter.NOOP);
    }

    public FileContext withDisablers(DisablerMap disablers) {
        return new FileContext(file, disablers, config, logger, problemReporter);
    }

    public ProblemLocation location(Statement statement) {
        if (statement.lineNumber() == Token.NO_POSITION) {
            return ProblemLocation.ofFile(file);
        }
        return ProblemLocation.ofLocationInFile(file, statement.lineNumber());
    }
}
