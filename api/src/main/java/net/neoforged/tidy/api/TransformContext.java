package net.neoforged.tidy.api;

/**
 * Run-wide context handed to transformers before and after all files have been processed.
 */
public record TransformContext(FormattingConfig config, Logger logger, ProblemReporter problemReporter) {
    public TransformContext(FormattingConfig config, Logger logger) {
        this(config, logger, ProblemReporter.NOOP);
    }
}
