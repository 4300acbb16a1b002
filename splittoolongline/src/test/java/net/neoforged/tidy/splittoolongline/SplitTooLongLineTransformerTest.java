package net.neoforged.tidy.splittoolongline;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.FormattingConfig;
import net.neoforged.tidy.api.LineEnding;
import net.neoforged.tidy.api.Logger;
import net.neoforged.tidy.api.ProblemReporter;
import net.neoforged.tidy.api.SeparatorStyle;
import net.neoforged.tidy.api.TransformContext;
import net.neoforged.tidy.api.disablers.DisablerResolver;
import net.neoforged.tidy.api.model.Token;
import net.neoforged.tidy.api.parsing.RobotParser;
import net.neoforged.tidy.api.parsing.RobotRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SplitTooLongLineTransformerTest {
    private static final FormattingConfig CONFIG = FormattingConfig.DEFAULT.withLineLength(40);

    private SplitTooLongLineTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new SplitTooLongLineTransformer();
    }

    private String format(String source) {
        return format(source, CONFIG);
    }

    private String format(String source, FormattingConfig config) {
        var logger = new Logger(null, null, null);
        transformer.beforeRun(new TransformContext(config, logger));
        var tree = RobotParser.parse(source);
        var context = new FileContext(Path.of("test.robot"), new DisablerResolver().resolve(tree), config, logger, ProblemReporter.NOOP);
        transformer.visitFile(tree, context);
        return RobotRenderer.render(tree);
    }

    private static List<String> dataCells(String source) {
        return RobotParser.parse(source).statements().stream()
                .flatMap(statement -> statement.dataTokens().stream())
                .map(Token::value)
                .toList();
    }

    @Test
    void fillsLinesUpToTheLimit() {
        assertThat(format("""
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    third argument
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    Log Many    first argument
                    ...    second argument
                    ...    third argument
                """);
    }

    @Test
    void everyArgumentOnItsOwnLine() {
        transformer.splitOnEveryArg = true;

        assertThat(format("""
                *** Test Cases ***
                Test
                    ${result}    Log Many    first argument    second argument
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    ${result}    Log Many
                    ...    first argument
                    ...    second argument
                """);
    }

    @Test
    void shortLinesAreLeftAlone() {
        var source = """
                *** Test Cases ***
                Test
                    Log    short
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void argumentsKeepTheirOrderAndText() {
        var source = """
                *** Keywords ***
                Kw
                    ${a}    ${b}=    Some Keyword    ${first_value}    second value    third=${value}    last one
                """;

        var formatted = format(source);

        assertThat(formatted).isNotEqualTo(source);
        assertThat(dataCells(formatted)).isEqualTo(dataCells(source));
    }

    @Test
    void statementWithoutKeywordIsSkipped() {
        var source = """
                *** Test Cases ***
                Test
                    ${first_variable}    ${second_variable}    ${third_variable}
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void templateArgumentsAreNotSplit() {
        var source = """
                *** Test Cases ***
                Test
                    [Template]    Should Be Equal
                    first long argument    second long argument
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void commentsMoveAboveTheSplitStatement() {
        assertThat(format("""
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    # note
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    # note
                    Log Many    first argument
                    ...    second argument
                """);
    }

    @Test
    void disablerDirectivesStayAtTheEnd() {
        assertThat(format("""
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    # robotidy: off=RenameVariables
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    Log Many    first argument
                    ...    second argument    # robotidy: off=RenameVariables
                """);
    }

    @Test
    void onlyDirectivesStayAtTheEnd() {
        assertThat(format("""
                *** Test Cases ***
                Test
                    Log Many    first argument
                    ...    second argument    # note
                    ...    third    # robotidy: on=RenameVariables
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    # note
                    Log Many    first argument
                    ...    second argument    third    # robotidy: on=RenameVariables
                """);
    }

    @Test
    void disabledStatementIsNotSplit() {
        var source = """
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    # robotidy: off
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void skippedKeywordsAreMatchedLikeRobotFramework() {
        transformer.skipKeywordCalls = List.of("log_many");
        var source = """
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    third argument
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void varStatementKeepsVariableOnFirstLine() {
        assertThat(format("""
                *** Test Cases ***
                Test
                    VAR    ${long}    value one    value two    value three
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    VAR    ${long}    value one
                    ...    value two    value three
                """);
    }

    @Test
    void everyValueOnItsOwnLine() {
        transformer.splitOnEveryValue = true;

        assertThat(format("""
                *** Test Cases ***
                Test
                    VAR    ${long}    value one    value two    value three
                """)).isEqualTo("""
                *** Test Cases ***
                Test
                    VAR    ${long}
                    ...    value one
                    ...    value two
                    ...    value three
                """);
    }

    @Test
    void continuationIndent() {
        var config = new FormattingConfig(4, 2, SeparatorStyle.SPACE, 40, LineEnding.AUTO, null, null);

        assertThat(format("""
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    third argument
                """, config)).isEqualTo("""
                *** Test Cases ***
                Test
                    Log Many    first argument
                    ...  second argument
                    ...  third argument
                """);
    }

    @Test
    void tabSeparatedOutput() {
        var config = new FormattingConfig(4, 4, SeparatorStyle.TAB, 40, LineEnding.AUTO, null, null);

        assertThat(format("*** Test Cases ***\nTest\n    Log Many    first argument    second argument    third argument\n", config))
                .isEqualTo("*** Test Cases ***\nTest\n    Log Many\tfirst argument\n    ...\tsecond argument\tthird argument\n");
    }

    @Test
    void configuredLineSeparatorOnlyAppliesToCreatedLines() {
        var config = new FormattingConfig(4, 4, SeparatorStyle.SPACE, 40, LineEnding.WINDOWS, null, null);

        assertThat(format("*** Test Cases ***\nTest\n    Log Many    first argument    second argument    third argument\n", config))
                .isEqualTo("*** Test Cases ***\nTest\n    Log Many    first argument\r\n    ...    second argument\r\n    ...    third argument\n");
    }

    @Test
    void variablesSectionEntries() {
        assertThat(format("""
                *** Variables ***
                ${LONG}    value one    value two    value three
                """)).isEqualTo("""
                *** Variables ***
                ${LONG}    value one    value two
                ...    value three
                """);
    }

    @Test
    void transformerLineLengthOverridesTheGlobalOne() {
        transformer.lineLength = 200;
        var source = """
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    third argument
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void splittingIsIdempotent() {
        var once = format("""
                *** Test Cases ***
                Test
                    Log Many    first argument    second argument    third argument    # why
                    ${x}    Set Variable    a rather long value    and another long value
                """);

        assertThat(format(once)).isEqualTo(once);
    }

    @Test
    void keepsWindowsLineSeparators() {
        var formatted = format("*** Test Cases ***\r\nTest\r\n    Log Many    first argument    second argument\r\n");

        assertThat(formatted).isEqualTo("*** Test Cases ***\r\nTest\r\n    Log Many    first argument\r\n    ...    second argument\r\n");
    }
}
