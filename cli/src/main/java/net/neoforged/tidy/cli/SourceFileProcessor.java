package net.neoforged.tidy.cli;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.FileSink;
import net.neoforged.tidy.api.FileSource;
import net.neoforged.tidy.api.FormattingConfig;
import net.neoforged.tidy.api.Logger;
import net.neoforged.tidy.api.ProblemReporter;
import net.neoforged.tidy.api.ProblemSeverity;
import net.neoforged.tidy.api.TidyProblems;
import net.neoforged.tidy.api.TransformerPipeline;
import net.neoforged.tidy.api.disablers.DisablerResolver;
import net.neoforged.tidy.api.parsing.RobotParser;
import net.neoforged.tidy.api.parsing.RobotRenderer;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Formats the files of a source: read, parse, resolve disablers, run the pipeline, render and write back if anything
 * changed. Files are processed in parallel, results are reported in source order.
 */
class SourceFileProcessor {
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final Logger logger;
    private final FormattingConfig config;
    private final TransformerPipeline pipeline;
    private final ProblemReporter problemReporter;
    private int maxQueueDepth = 50;
    private int reruns;

    public SourceFileProcessor(Logger logger, FormattingConfig config, TransformerPipeline pipeline, ProblemReporter problemReporter) {
        this.logger = logger;
        this.config = config;
        this.pipeline = pipeline;
        this.problemReporter = problemReporter;
    }

    public void process(FileSource source, FileSink sink, RunReporter reporter) throws IOException {
        try (var queue = new OrderedParallelWorkQueue<FileResult>(result -> write(result, sink, reporter), maxQueueDepth);
             var stream = source.streamEntries()) {
            stream.forEach(entry -> queue.submit(() -> processEntry(entry)));
        }
    }

    private void write(FileResult result, FileSink sink, RunReporter reporter) {
        var content = result.content();
        boolean write = switch (result.outcome()) {
            case REFORMATTED -> true;
            case UNCHANGED, DISABLED -> sink.acceptsUnchangedFiles();
            case SKIPPED -> false;
        };
        if (write && content != null) {
            try {
                sink.putFile(result.entry(), content);
            } catch (IOException e) {
                logger.error("Failed to write %s: %s", result.entry().path(), e);
                problemReporter.reportFileProblem(TidyProblems.WRITE_FAILURE, ProblemSeverity.ERROR, result.entry().path(), e.toString());
                reporter.record(result.entry(), FileOutcome.SKIPPED);
                return;
            }
        }
        reporter.record(result.entry(), result.outcome());
    }

    private FileResult processEntry(FileEntry entry) {
        byte[] original;
        try (var in = entry.openInputStream()) {
            original = in.readAllBytes();
        } catch (IOException e) {
            return skip(entry, "Failed to read " + entry.path() + ": " + e);
        }

        String text;
        try {
            text = decode(original);
        } catch (CharacterCodingException e) {
            return skip(entry, "Failed to decode " + entry.path() + " as UTF-8: " + e);
        }

        boolean bom = text.startsWith(BYTE_ORDER_MARK);
        var formatted = formatSource(bom ? text.substring(1) : text, entry.path());
        if (formatted == null) {
            return new FileResult(entry, FileOutcome.DISABLED, original);
        }
        if (bom) {
            formatted = BYTE_ORDER_MARK + formatted;
        }
        if (formatted.equals(text)) {
            return new FileResult(entry, FileOutcome.UNCHANGED, original);
        }
        return new FileResult(entry, FileOutcome.REFORMATTED, formatted.getBytes(StandardCharsets.UTF_8));
    }

    private FileResult skip(FileEntry entry, String message) {
        logger.error("%s", message);
        problemReporter.reportFileProblem(TidyProblems.PARSE_FAILURE, ProblemSeverity.ERROR, entry.path(), message);
        return FileResult.of(entry, FileOutcome.SKIPPED);
    }

    /**
     * Formats the text of one file, running the pipeline again on its own output up to {@code reruns} times while
     * that still changes it.
     *
     * @return the formatted text, or {@code null} if all transformers are disabled on the whole file
     */
    @VisibleForTesting
    @Nullable
    String formatSource(String text, Path file) {
        var current = text;
        var formatted = formatOnce(current, file);
        for (int i = 0; formatted != null && i < reruns && !formatted.equals(current); i++) {
            current = formatted;
            formatted = formatOnce(current, file);
        }
        return formatted;
    }

    private @Nullable String formatOnce(String text, Path file) {
        var tree = RobotParser.parse(text);
        var disablers = new DisablerResolver(config.startLine(), config.endLine()).resolve(tree);
        if (disablers.isDisabledInFile()) {
            return null;
        }
        for (var name : disablers.inertNames()) {
            logger.debug("%s: ignoring disabler for unknown transformer %s", file, name);
        }
        pipeline.run(tree, new FileContext(file, disablers, config, logger, problemReporter));
        return RobotRenderer.render(tree);
    }

    private static String decode(byte[] content) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
    }

    public void setMaxQueueDepth(int maxQueueDepth) {
        this.maxQueueDepth = maxQueueDepth;
    }

    public void setReruns(int reruns) {
        this.reruns = reruns;
    }
}
