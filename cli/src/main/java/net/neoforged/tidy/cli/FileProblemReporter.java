package net.neoforged.tidy.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import net.neoforged.tidy.api.Logger;
import net.neoforged.tidy.api.ProblemId;
import net.neoforged.tidy.api.ProblemLocation;
import net.neoforged.tidy.api.ProblemReporter;
import net.neoforged.tidy.api.ProblemSeverity;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.VisibleForTesting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the problems of a run and writes them to a JSON file when closed, ordered by file and line since files
 * report from several threads.
 */
@ApiStatus.Internal
public class FileProblemReporter implements ProblemReporter, AutoCloseable {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeHierarchyAdapter(Path.class, new TypeAdapter<Path>() {
                @Override
                public void write(JsonWriter out, Path value) throws IOException {
                    out.value(value.toString().replace('\\', '/'));
                }

                @Override
                public Path read(JsonReader in) throws IOException {
                    return Paths.get(in.nextString());
                }
            })
            .create();

    private static final Comparator<ProblemRecord> ORDER = Comparator
            .comparing((ProblemRecord record) -> record.location().file().toString())
            .thenComparing(record -> record.location().line(), Comparator.nullsFirst(Comparator.<Integer>naturalOrder()))
            .thenComparing(record -> record.location().column(), Comparator.nullsFirst(Comparator.<Integer>naturalOrder()));

    private final Logger logger;
    private final Path reportFile;

    private final List<ProblemRecord> problems = new ArrayList<>();

    public FileProblemReporter(Logger logger, Path reportFile) {
        this.logger = logger;
        this.reportFile = reportFile;
    }

    @Override
    public synchronized void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
        problems.add(new ProblemRecord(problemId.toString(), severity, location, message));
    }

    @Override
    public synchronized void close() throws IOException {
        var sorted = new ArrayList<>(problems);
        // stable, so problems of one statement keep the order transformers reported them in
        sorted.sort(ORDER);
        logger.debug("Writing %d problems to %s", sorted.size(), reportFile);
        try (var writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8)) {
            GSON.toJson(sorted, writer);
        }
    }

    @VisibleForTesting
    public static List<ProblemRecord> loadRecords(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return Arrays.asList(GSON.fromJson(reader, ProblemRecord[].class));
        }
    }

    /**
     * @param problemId the id of the problem, written as {@code group:id}
     */
    public record ProblemRecord(
            String problemId,
            ProblemSeverity severity,
            ProblemLocation location,
            String message
    ) {
    }
}
