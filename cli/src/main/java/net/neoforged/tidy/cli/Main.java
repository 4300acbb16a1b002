package net.neoforged.tidy.cli;

import net.neoforged.tidy.api.FormattingConfig;
import net.neoforged.tidy.api.LineEnding;
import net.neoforged.tidy.api.Logger;
import net.neoforged.tidy.api.ProblemReporter;
import net.neoforged.tidy.api.SeparatorStyle;
import net.neoforged.tidy.api.SourceTransformer;
import net.neoforged.tidy.api.SourceTransformerPlugin;
import net.neoforged.tidy.api.TransformContext;
import net.neoforged.tidy.api.TransformerId;
import net.neoforged.tidy.api.TransformerPipeline;
import net.neoforged.tidy.cli.io.FileSinks;
import net.neoforged.tidy.cli.io.FileSources;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

@CommandLine.Command(name = "robot-tidy", mixinStandardHelpOptions = true, usageHelpWidth = 100,
        description = "Formats Robot Framework files. Options can also be read from @argument files.")
public class Main implements Callable<Integer> {
    static final String DEFAULT_EXCLUDE = "(\\.direnv|\\.eggs|\\.git|\\.hg|\\.nox|\\.tox|\\.venv|venv|\\.svn)";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*", description = "Files or folders to format. Folders are searched for .robot and .resource files.")
    List<Path> paths = new ArrayList<>();

    @CommandLine.Option(names = {"-t", "--transform"}, paramLabel = "NAME", description = "Run only the given transformers. Can be repeated.")
    List<String> transforms = new ArrayList<>();

    @CommandLine.Option(names = "--force-order", description = "Run the transformers given with --transform in the order they were given.")
    boolean forceOrder;

    @CommandLine.Option(names = "--check", description = "Do not write files, exit with 1 if any file would be reformatted.")
    boolean check;

    @CommandLine.Option(names = "--overwrite", negatable = true, description = "Write formatted files back. Enabled unless --check is given.")
    Boolean overwrite;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the formatted result of a single source file to this file instead.")
    Path output;

    @CommandLine.Option(names = {"-s", "--spacecount"}, description = "Number of spaces between cells. Default: ${DEFAULT-VALUE}")
    int spaceCount = 4;

    @CommandLine.Option(names = "--continuation-indent", description = "Number of spaces after ... on continuation lines. Defaults to --spacecount.")
    Integer continuationIndent;

    @CommandLine.Option(names = "--separator", description = "Separate cells with spaces or a tab: ${COMPLETION-CANDIDATES}")
    SeparatorStyle separator = SeparatorStyle.SPACE;

    @CommandLine.Option(names = {"-ll", "--line-length"}, description = "Maximum line length. Default: ${DEFAULT-VALUE}")
    int lineLength = 120;

    @CommandLine.Option(names = {"-ls", "--lineseparator"}, description = "Line separator of lines created by transformers: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    LineEnding lineEnding = LineEnding.AUTO;

    @CommandLine.Option(names = {"-sl", "--startline"}, description = "Only format from this line on.")
    Integer startLine;

    @CommandLine.Option(names = {"-el", "--endline"}, description = "Only format up to this line.")
    Integer endLine;

    @CommandLine.Option(names = "--exclude", paramLabel = "REGEX", description = "Paths inside folders matching this pattern are not formatted. Default: ${DEFAULT-VALUE}")
    Pattern exclude = Pattern.compile(DEFAULT_EXCLUDE);

    @CommandLine.Option(names = "--extend-exclude", paramLabel = "REGEX", description = "Additional paths to exclude, keeping the default --exclude.")
    Pattern extendExclude;

    @CommandLine.Option(names = "--reruns", description = "Run the transformers again on their own output up to this many times while it still changes.")
    int reruns = 0;

    @CommandLine.Option(names = {"-l", "--list"}, arity = "0..1", fallbackValue = "ALL", paramLabel = "FILTER", description = "List transformers: ${COMPLETION-CANDIDATES}")
    ListFilter list;

    @CommandLine.Option(names = {"-d", "--desc"}, arity = "0..1", fallbackValue = "all", paramLabel = "NAME", description = "Describe a transformer, or all of them.")
    String desc;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Print additional debugging information")
    boolean verbose;

    @CommandLine.Option(names = "--problems-report", paramLabel = "FILE", description = "Write all problems found during the run to this JSON file.")
    Path problemsReport;

    @CommandLine.Option(names = "--max-queue-depth", description = "Number of files processed in parallel. 0 processes files one after the other.")
    int maxQueueDepth = 100;

    private final Map<TransformerId, SourceTransformerPlugin> plugins = new EnumMap<>(TransformerId.class);
    private final Map<TransformerId, SourceTransformer> transformers = new EnumMap<>(TransformerId.class);

    public static void main(String[] args) {
        System.exit(innerMain(args));
    }

    @VisibleForTesting
    public static int innerMain(String... args) {
        // Load these up front so that they can add CommandLine Options
        var plugins = ServiceLoader.load(SourceTransformerPlugin.class).stream().map(ServiceLoader.Provider::get).toList();

        var main = new Main();
        var commandLine = new CommandLine(main);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        var spec = commandLine.getCommandSpec();

        main.setupPluginCliOptions(plugins, spec);
        return commandLine.execute(args);
    }

    @Override
    public Integer call() throws Exception {
        var logger = new Logger(System.out, verbose ? System.err : null, System.err);

        if (list != null) {
            listTransformers(logger);
            return 0;
        }
        if (desc != null) {
            describeTransformers(logger);
            return 0;
        }

        var pipeline = new TransformerPipeline(selectTransformers());
        var config = createConfig();

        if (paths.isEmpty()) {
            logger.error("No source paths given. Run with --help to see how to use robot-tidy.");
            return 1;
        }
        for (var path : paths) {
            if (!Files.exists(path)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Path does not exist: " + path);
            }
        }
        if (output != null && (paths.size() != 1 || !Files.isRegularFile(paths.get(0)))) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--output requires exactly one source file");
        }

        var problemReporter = problemsReport != null ? new FileProblemReporter(logger, problemsReport) : null;
        try {
            return run(logger, config, pipeline, problemReporter != null ? problemReporter : ProblemReporter.NOOP);
        } finally {
            if (problemReporter != null) {
                problemReporter.close();
            }
        }
    }

    private int run(Logger logger, FormattingConfig config, TransformerPipeline pipeline, ProblemReporter problemReporter) throws IOException {
        var context = new TransformContext(config, logger, problemReporter);
        for (var stage : pipeline.stages()) {
            try {
                stage.transformer().beforeRun(context);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }

        var processor = new SourceFileProcessor(logger, config, pipeline, problemReporter);
        processor.setMaxQueueDepth(maxQueueDepth);
        processor.setReruns(reruns);

        var reporter = new RunReporter(logger, check);
        var writeFiles = overwrite != null ? overwrite : !check;
        for (var path : paths) {
            try (var source = FileSources.create(path, exclude, extendExclude);
                 var sink = FileSinks.create(source, output, writeFiles)) {
                processor.process(source, sink, reporter);
            }
        }

        boolean isOk = true;
        for (var stage : pipeline.stages()) {
            isOk = stage.transformer().afterRun(context) && isOk;
        }
        reporter.printSummary();

        if (!isOk) {
            logger.error("Transformation failed");
            return 1;
        }
        return check && reporter.reformatted() > 0 ? 1 : 0;
    }

    private List<TransformerPipeline.Stage> selectTransformers() {
        var selected = new LinkedHashSet<TransformerId>();
        if (transforms.isEmpty()) {
            for (var id : TransformerId.values()) {
                if (id.isEnabledByDefault()) {
                    selected.add(id);
                }
            }
        } else {
            for (var name : transforms) {
                var id = TransformerId.byName(name.strip())
                        .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Unknown transformer: " + name));
                selected.add(id);
            }
        }

        var ordered = new ArrayList<>(selected);
        if (!forceOrder) {
            ordered.sort(null);
        }
        var stages = new ArrayList<TransformerPipeline.Stage>();
        for (var id : ordered) {
            var transformer = transformers.get(id);
            if (transformer == null) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Transformer " + id + " is not available");
            }
            stages.add(new TransformerPipeline.Stage(id, transformer));
        }
        return stages;
    }

    private FormattingConfig createConfig() {
        try {
            return new FormattingConfig(
                    spaceCount,
                    continuationIndent != null ? continuationIndent : spaceCount,
                    separator,
                    lineLength,
                    lineEnding,
                    startLine,
                    endLine
            );
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private void listTransformers(Logger logger) {
        var enabled = new LinkedHashSet<TransformerId>();
        for (var stage : selectTransformers()) {
            enabled.add(stage.id());
        }
        logger.info("Transformers:");
        for (var id : TransformerId.values()) {
            boolean isEnabled = enabled.contains(id);
            if (list == ListFilter.ALL || (list == ListFilter.ENABLED) == isEnabled) {
                logger.info("  %-20s %s", id.getName(), isEnabled ? "enabled" : "disabled");
            }
        }
    }

    private void describeTransformers(Logger logger) {
        if (desc.equalsIgnoreCase("all")) {
            for (var plugin : plugins.values()) {
                logger.info("%s: %s", plugin.getName(), plugin.getDescription());
            }
            return;
        }
        var id = TransformerId.byName(desc)
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Unknown transformer: " + desc));
        var plugin = plugins.get(id);
        if (plugin == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Transformer " + id + " is not available");
        }
        logger.info("%s: %s", plugin.getName(), plugin.getDescription());
    }

    private void setupPluginCliOptions(List<SourceTransformerPlugin> plugins, CommandLine.Model.CommandSpec spec) {
        for (var plugin : plugins) {
            var transformer = plugin.createTransformer();
            this.plugins.put(plugin.getId(), plugin);
            this.transformers.put(plugin.getId(), transformer);

            var transformerSpec = CommandLine.Model.CommandSpec.forAnnotatedObject(transformer);
            if (transformerSpec.options().isEmpty()) {
                continue;
            }

            var builder = CommandLine.Model.ArgGroupSpec.builder();
            builder
                    .exclusive(false)
                    .heading("Transformer - " + plugin.getName() + "%n");
            for (var option : transformerSpec.options()) {
                builder.addArg(option);
            }
            spec.addArgGroup(builder.build());
        }
    }
}
