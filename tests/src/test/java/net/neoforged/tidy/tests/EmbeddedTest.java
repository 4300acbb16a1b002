package net.neoforged.tidy.tests;

import net.neoforged.tidy.api.ProblemSeverity;
import net.neoforged.tidy.cli.FileProblemReporter;
import net.neoforged.tidy.cli.Main;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line tool in-process over the folders in {@code data/}. Each test folder has a {@code source}
 * folder that is copied and formatted, an {@code expected} folder with the result and optionally an
 * {@code expected.log} with the console output.
 */
public class EmbeddedTest {
    @TempDir
    private Path tempDir;

    private final Path testDataRoot = Paths.get(getRequiredSystemProperty("tidy.testDataDir"));

    @Nested
    class SplitTooLongLine {
        @Test
        void testFillLines() throws Exception {
            runTest("splittoolongline/fill", "--line-length", "60");
        }

        @Test
        void testSplitOnEveryArg() throws Exception {
            runTest("splittoolongline/every_arg", "--line-length", "60", "--split-too-long-line-split-on-every-arg");
        }

        @Test
        void testTransformerLineLength() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        Log Many    first argument    second argument    third argument
                    """);

            var output = runTool(source.toString(), "--line-length", "40", "--split-too-long-line-line-length", "100");

            assertThat(output).isEqualTo("0 files reformatted, 1 file left unchanged. 0 files skipped.\n");
        }
    }

    @Nested
    class RenameVariables {
        @Test
        void testDefaultConventions() throws Exception {
            runTest("renamevariables/default", "-t", "RenameVariables");
        }

        @Test
        void testConventionOptions() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        ${localValue}    Set Variable    ${globalValue}
                    """);

            runTool(source.toString(), "-t", "RenameVariables",
                    "--rename-variables-separator", "space",
                    "--rename-variables-unknown-variables-case", "ignore");

            assertThat(source).hasContent("""
                    *** Test Cases ***
                    Test
                        ${local value}    Set Variable    ${global Value}
                    """);
        }
    }

    @Nested
    class ReplaceWithVar {
        @Test
        void testLegacyKeywords() throws Exception {
            runTest("replacewithvar/default", "-t", "ReplaceWithVAR");
        }

        @Test
        void testSkippedKeyword() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        ${a}    Catenate    x    y
                        ${b}    Set Variable    z
                    """);

            runTool(source.toString(), "-t", "ReplaceWithVAR", "--replace-with-var-skip", "Catenate");

            assertThat(source).hasContent("""
                    *** Test Cases ***
                    Test
                        ${a}    Catenate    x    y
                        VAR    ${b}    z
                    """);
        }
    }

    @Nested
    class Disablers {
        @Test
        void testDisabledLinesAndFiles() throws Exception {
            runTest("disablers/default", "-t", "ReplaceWithVAR", "-t", "RenameVariables", "-t", "SplitTooLongLine", "--line-length", "60");
        }

        @Test
        void testLineWindow() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        ${a}    Set Variable    1
                        ${b}    Set Variable    2
                        ${c}    Set Variable    3
                    """);

            runTool(source.toString(), "-t", "ReplaceWithVAR", "--startline", "4", "--endline", "4");

            assertThat(source).hasContent("""
                    *** Test Cases ***
                    Test
                        ${a}    Set Variable    1
                        VAR    ${b}    2
                        ${c}    Set Variable    3
                    """);
        }
    }

    @Nested
    class Pipeline {
        @Test
        void testAllTransformers() throws Exception {
            // listed out of order on purpose, they run in their default order
            runTest("pipeline/all", "-t", "SplitTooLongLine", "-t", "RenameVariables", "-t", "ReplaceWithVAR", "--line-length", "50");
        }

        @Test
        void testSecondRunChangesNothing() throws Exception {
            var workDir = copySource("pipeline/all");
            var args = new String[]{workDir.toString(), "-t", "SplitTooLongLine", "-t", "RenameVariables", "-t", "ReplaceWithVAR", "--line-length", "50"};

            runTool(args);
            var output = runTool(args);

            assertThat(output).isEqualTo("0 files reformatted, 1 file left unchanged. 0 files skipped.\n");
            assertSameContent(workDir, testDataRoot.resolve("pipeline/all/expected"));
        }

        @Test
        void testTrailingEnableDirectiveStaysInline() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        # robotidy: off=RenameVariables
                        Log Many    ${Var}    first argument    second argument    # robotidy: on=RenameVariables
                        Log    ${Other}
                    """);
            var args = new String[]{source.toString(), "-t", "RenameVariables", "-t", "SplitTooLongLine", "--line-length", "50"};
            var expected = """
                    *** Test Cases ***
                    Test
                        # robotidy: off=RenameVariables
                        Log Many    ${Var}    first argument
                        ...    second argument    # robotidy: on=RenameVariables
                        Log    ${Other}
                    """;

            runTool(args);
            assertThat(source).hasContent(expected);

            assertThat(runTool(args)).isEqualTo("0 files reformatted, 1 file left unchanged. 0 files skipped.\n");
            assertThat(source).hasContent(expected);
        }

        @Test
        void testTrailingDisableDirectiveOnlyCoversItsStatement() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        Log Many    ${Var}    first argument    second argument    # robotidy: off=RenameVariables
                        Log    ${Other}
                    """);
            var args = new String[]{source.toString(), "--force-order", "-t", "SplitTooLongLine", "-t", "RenameVariables", "--line-length", "50"};
            var expected = """
                    *** Test Cases ***
                    Test
                        Log Many    ${Var}    first argument
                        ...    second argument    # robotidy: off=RenameVariables
                        Log    ${OTHER}
                    """;

            runTool(args);
            assertThat(source).hasContent(expected);

            assertThat(runTool(args)).isEqualTo("0 files reformatted, 1 file left unchanged. 0 files skipped.\n");
            assertThat(source).hasContent(expected);
        }

        @Test
        void testForcedOrder() throws Exception {
            var source = writeFile("test.robot", """
                    *** Keywords ***
                    Kw
                        ${greeting}    Catenate    SEPARATOR=-    Hello    ${name}    and    welcome    back
                    """);

            // splitting first leaves a call that is then replaced by a single VAR line
            runTool(source.toString(), "--force-order", "-t", "SplitTooLongLine", "-t", "ReplaceWithVAR", "--line-length", "50");

            assertThat(source).hasContent("""
                    *** Keywords ***
                    Kw
                        VAR    ${greeting}    Hello    ${name}    and    welcome    back    separator=-
                    """);
        }

        @Test
        void testReruns() throws Exception {
            var source = writeFile("test.robot", """
                    *** Test Cases ***
                    Test
                        ${greeting}    Catenate    SEPARATOR=-    Hello    ${name}    and    welcome    back
                    """);

            runTool(source.toString(), "--force-order", "-t", "SplitTooLongLine", "-t", "ReplaceWithVAR", "--line-length", "50", "--reruns", "1");

            assertThat(source).hasContent("""
                    *** Test Cases ***
                    Test
                        VAR    ${greeting}    Hello    ${name}    and
                        ...    welcome    back    separator=-
                    """);
        }
    }

    @Nested
    class CommandLine {
        @Test
        void testCheckDoesNotWrite() throws Exception {
            var workDir = copySource("replacewithvar/default");

            var result = runToolWithExitCode(workDir.toString(), "-t", "ReplaceWithVAR", "--check");

            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.output().replace(workDir.toString(), "{dir}").replace('\\', '/')).isEqualTo("""
                    Would reformat {dir}/test.robot
                    1 file reformatted, 0 files left unchanged. 0 files skipped.
                    """);
            assertSameContent(workDir, testDataRoot.resolve("replacewithvar/default/source"));
        }

        @Test
        void testCheckWithNothingToDo() throws Exception {
            var workDir = copySource("replacewithvar/default");
            runTool(workDir.toString(), "-t", "ReplaceWithVAR");

            var result = runToolWithExitCode(workDir.toString(), "-t", "ReplaceWithVAR", "--check");

            assertThat(result.exitCode()).isEqualTo(0);
        }

        @Test
        void testOutputFile() throws Exception {
            var source = writeFile("test.robot", "*** Test Cases ***\nTest\n    ${x}    Set Variable    1\n");
            var output = tempDir.resolve("formatted.robot");

            runTool(source.toString(), "-t", "ReplaceWithVAR", "--output", output.toString());

            assertThat(source).hasContent("*** Test Cases ***\nTest\n    ${x}    Set Variable    1\n");
            assertThat(output).hasContent("*** Test Cases ***\nTest\n    VAR    ${x}    1\n");
        }

        @Test
        void testUnknownTransformer() throws Exception {
            var source = writeFile("test.robot", "*** Test Cases ***\n");

            var result = runToolWithExitCode(source.toString(), "-t", "NoSuchTransformer");

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.output()).contains("Unknown transformer: NoSuchTransformer");
        }

        @Test
        void testInvalidTransformerOption() throws Exception {
            var source = writeFile("test.robot", "*** Test Cases ***\n");

            var result = runToolWithExitCode(source.toString(), "-t", "ReplaceWithVAR", "--replace-with-var-skip", "Log");

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.output()).contains("Log");
        }

        @Test
        void testIndentIsNotAnOption() throws Exception {
            var source = writeFile("test.robot", "*** Test Cases ***\n");

            var result = runToolWithExitCode(source.toString(), "--indent", "2");

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.output()).contains("--indent");
        }

        @Test
        void testNoPaths() throws Exception {
            var result = runToolWithExitCode("-t", "ReplaceWithVAR");

            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.output()).contains("No source paths given");
        }

        @Test
        void testList() throws Exception {
            var output = runTool("--list");

            assertThat(output).contains("ReplaceWithVAR", "RenameVariables", "SplitTooLongLine");
            assertThat(output).containsPattern("SplitTooLongLine\\s+enabled");
            assertThat(output).containsPattern("RenameVariables\\s+disabled");
        }

        @Test
        void testListEnabled() throws Exception {
            var output = runTool("--list", "ENABLED", "-t", "RenameVariables");

            assertThat(output).contains("RenameVariables").doesNotContain("SplitTooLongLine", "ReplaceWithVAR");
        }

        @Test
        void testDescribe() throws Exception {
            var output = runTool("--desc", "ReplaceWithVAR");

            assertThat(output).startsWith("ReplaceWithVAR: ").contains("Set Variable");
        }
    }

    @Nested
    class SkippedFiles {
        @Test
        void testUndecodableFileIsSkipped() throws Exception {
            var broken = tempDir.resolve("broken.robot");
            Files.write(broken, new byte[]{'*', '*', '*', ' ', (byte) 0xC3, (byte) 0x28, '\n'});

            var result = runToolWithExitCode(broken.toString());

            assertThat(result.exitCode()).isEqualTo(0);
            assertThat(result.output()).endsWith("0 files reformatted, 0 files left unchanged. 1 file skipped.\n");
        }

        @Test
        void testOtherFilesAreStillFormatted() throws Exception {
            Files.write(tempDir.resolve("a_broken.robot"), new byte[]{(byte) 0xFF, (byte) 0xFE, '\n'});
            var good = writeFile("b_good.robot", "*** Test Cases ***\nTest\n    ${x}    Set Variable    1\n");
            var report = tempDir.resolve("problems.json");

            var result = runToolWithExitCode(tempDir.toString(), "-t", "ReplaceWithVAR", "--problems-report", report.toString());

            assertThat(result.output()).endsWith("1 file reformatted, 0 files left unchanged. 1 file skipped.\n");
            assertThat(good).hasContent("*** Test Cases ***\nTest\n    VAR    ${x}    1\n");

            var problems = FileProblemReporter.loadRecords(report);
            assertThat(problems).hasSize(1);
            var problem = problems.get(0);
            assertThat(problem.problemId()).isEqualTo("robot-tidy:parse-failure");
            assertThat(problem.severity()).isEqualTo(ProblemSeverity.ERROR);
            assertThat(problem.location()).isNotNull();
            assertThat(problem.location().file().getFileName().toString()).isEqualTo("a_broken.robot");
        }
    }

    protected final void runTest(String testDirName, String... args) throws Exception {
        var testDir = testDataRoot.resolve(testDirName);
        var workDir = copySource(testDirName);

        var allArgs = new ArrayList<String>();
        allArgs.add(workDir.toString());
        allArgs.addAll(Arrays.asList(args));
        var output = runTool(allArgs.toArray(String[]::new));

        assertSameContent(workDir, testDir.resolve("expected"));

        var expectedLog = testDir.resolve("expected.log");
        if (Files.exists(expectedLog)) {
            assertThat(output).isEqualTo(Files.readString(expectedLog));
        }
    }

    private Path copySource(String testDirName) throws IOException {
        var sourceDir = testDataRoot.resolve(testDirName).resolve("source");
        var workDir = tempDir.resolve("work");
        try (var stream = Files.walk(sourceDir)) {
            for (var path : stream.toList()) {
                var target = workDir.resolve(sourceDir.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(target);
                } else {
                    Files.copy(path, target);
                }
            }
        }
        return workDir;
    }

    private Path writeFile(String name, String content) throws IOException {
        var file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static void assertSameContent(Path actualDir, Path expectedDir) throws IOException {
        var actualContent = loadDirToMap(actualDir);
        var expectedContent = loadDirToMap(expectedDir);
        assertThat(actualContent).containsExactlyInAnyOrderEntriesOf(expectedContent);
    }

    private static Map<String, String> loadDirToMap(Path dir) throws IOException {
        var result = new HashMap<String, String>();
        try (Stream<Path> stream = Files.walk(dir)) {
            for (var path : stream.filter(Files::isRegularFile).toList()) {
                var relativePath = dir.relativize(path).toString().replace('\\', '/');
                result.put(relativePath, Files.readString(path));
            }
        }
        return result;
    }

    protected final String runTool(String... args) throws Exception {
        var result = runToolWithExitCode(args);
        if (result.exitCode() != 0) {
            throw new RuntimeException("Process failed with exit code " + result.exitCode() + ": " + result.output());
        }
        return result.output();
    }

    protected final ToolResult runToolWithExitCode(String... args) {
        // This is thread hostile, but what can I do :-[
        var oldOut = System.out;
        var oldErr = System.err;
        var capturedOut = new ByteArrayOutputStream();
        int exitCode;
        try {
            System.setErr(new PrintStream(capturedOut, true, StandardCharsets.UTF_8));
            System.setOut(new PrintStream(capturedOut, true, StandardCharsets.UTF_8));
            exitCode = Main.innerMain(args);
        } finally {
            System.setErr(oldErr);
            System.setOut(oldOut);
        }
        return new ToolResult(exitCode, capturedOut.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }

    protected record ToolResult(int exitCode, String output) {
    }

    private static String getRequiredSystemProperty(String key) {
        var value = System.getProperty(key);
        if (value == null) {
            throw new RuntimeException("Missing system property: " + key);
        }
        return value;
    }
}
