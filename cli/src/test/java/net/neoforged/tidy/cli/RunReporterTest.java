package net.neoforged.tidy.cli;

import net.neoforged.tidy.api.FileEntries;
import net.neoforged.tidy.api.Logger;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RunReporterTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final Logger logger = new Logger(new PrintStream(out, true, StandardCharsets.UTF_8), null, null);

    @Test
    void emptyRun() {
        var reporter = new RunReporter(logger, false);

        assertThat(reporter.summary()).isEqualTo("0 files reformatted, 0 files left unchanged. 0 files skipped.");
    }

    @Test
    void singleSkippedFile() {
        var reporter = new RunReporter(logger, false);
        reporter.record(FileEntries.ofFile(Path.of("broken.robot")), FileOutcome.SKIPPED);

        assertThat(reporter.summary()).isEqualTo("0 files reformatted, 0 files left unchanged. 1 file skipped.");
    }

    @Test
    void disabledFilesCountAsUnchanged() {
        var reporter = new RunReporter(logger, false);
        reporter.record(FileEntries.ofFile(Path.of("a.robot")), FileOutcome.REFORMATTED);
        reporter.record(FileEntries.ofFile(Path.of("b.robot")), FileOutcome.UNCHANGED);
        reporter.record(FileEntries.ofFile(Path.of("c.robot")), FileOutcome.DISABLED);

        assertThat(reporter.summary()).isEqualTo("1 file reformatted, 2 files left unchanged. 0 files skipped.");
        assertThat(reporter.reformatted()).isEqualTo(1);
        assertThat(reporter.unchanged()).isEqualTo(2);
    }

    @Test
    void checkModeNamesFilesThatWouldChange() {
        var reporter = new RunReporter(logger, true);
        reporter.record(FileEntries.ofFile(Path.of("a.robot")), FileOutcome.REFORMATTED);
        reporter.record(FileEntries.ofFile(Path.of("b.robot")), FileOutcome.UNCHANGED);
        reporter.printSummary();

        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Would reformat a.robot")
                .doesNotContain("b.robot")
                .contains("1 file reformatted, 1 file left unchanged. 0 files skipped.");
    }
}
