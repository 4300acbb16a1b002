package net.neoforged.tidy.replacewithvar;

import net.neoforged.tidy.api.FileContext;
import net.neoforged.tidy.api.FormattingConfig;
import net.neoforged.tidy.api.Logger;
import net.neoforged.tidy.api.ProblemReporter;
import net.neoforged.tidy.api.TransformContext;
import net.neoforged.tidy.api.disablers.DisablerResolver;
import net.neoforged.tidy.api.parsing.RobotParser;
import net.neoforged.tidy.api.parsing.RobotRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplaceWithVarTransformerTest {
    private ReplaceWithVarTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new ReplaceWithVarTransformer();
    }

    private String format(String source) {
        var logger = new Logger(null, null, null);
        transformer.beforeRun(new TransformContext(FormattingConfig.DEFAULT, logger));
        var tree = RobotParser.parse(source);
        var context = new FileContext(Path.of("test.robot"), new DisablerResolver().resolve(tree), FormattingConfig.DEFAULT,
                logger, ProblemReporter.NOOP);
        transformer.visitFile(tree, context);
        return RobotRenderer.render(tree);
    }

    private String formatStatement(String statement) {
        var formatted = format("*** Test Cases ***\nTest\n    " + statement + "\n");
        return formatted.substring("*** Test Cases ***\nTest\n    ".length(), formatted.length() - 1);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', textBlock = """
            ${value}    Catenate    SEPARATOR=    value           | VAR    ${value}    value    separator=${EMPTY}
            ${value}    Catenate    SEPARATOR=-    a    b         | VAR    ${value}    a    b    separator=-
            ${value}    Catenate    a    b                        | VAR    ${value}    a    b
            ${dict}    Create Dictionary    key    value          | VAR    &{dict}    key=value
            ${d}    Create Dictionary    a    1    b=2    &{more} | VAR    &{d}    a=1    b=2    &{more}
            &{d}    Create Dictionary                             | VAR    &{d}
            @{list}    Create List    a    b                      | VAR    @{list}    a    b
            ${list}    Create List    a                           | VAR    @{list}    a
            ${x}=    Set Variable    1                            | VAR    ${x}    1
            ${x}    Set Variable    ${other}                      | VAR    ${x}    ${other}
            Set Test Variable    ${name}    value                 | VAR    ${name}    value    scope=TEST
            Set Task Variable    ${name}    value                 | VAR    ${name}    value    scope=TASK
            Set Suite Variable    \\${name}    value              | VAR    ${name}    value    scope=SUITE
            Set Global Variable    @{items}    a    b             | VAR    @{items}    a    b    scope=GLOBAL
            Set Local Variable    $name    value                  | VAR    ${name}    value    scope=LOCAL
            set_test_variable    ${name}    value                 | VAR    ${name}    value    scope=TEST
            """)
    void replacesLegacyKeywords(String call, String expected) {
        assertThat(formatStatement(call.strip())).isEqualTo(expected.strip());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "${dict}    Create Dictionary    key    value    odd",
            "${dict}    Create Dictionary    a=1    positional",
            "${dict}    Create Dictionary    @{pairs}",
            "${x}    Set Variable    a    b",
            "${x}    Set Variable    @{list}",
            "${x}    Set Variable    scope=SUITE",
            "@{list}    Set Variable    a",
            "${a}    ${b}    Set Variable    1",
            "${dict}[key]    Set Variable    1",
            "Set Test Variable    ${name}",
            "Set Test Variable    ${name}    a    b",
            "Set Suite Variable    ${name}    value    children=True",
            "${x}    Set Test Variable    ${name}    value",
            "${x}    Log    message"
    })
    void leavesAmbiguousCallsAlone(String call) {
        assertThat(formatStatement(call)).isEqualTo(call);
    }

    @Test
    void keepsIndentAndComments() {
        assertThat(format("""
                *** Keywords ***
                Kw
                    IF    ${condition}
                        ${x}    Set Variable    1    # note
                    END
                """)).isEqualTo("""
                *** Keywords ***
                Kw
                    IF    ${condition}
                        VAR    ${x}    1    # note
                    END
                """);
    }

    @Test
    void usesConfiguredSeparator() {
        var logger = new Logger(null, null, null);
        var config = new FormattingConfig(2, 4, FormattingConfig.DEFAULT.separatorStyle(), 120, FormattingConfig.DEFAULT.lineEnding(), null, null);
        transformer.beforeRun(new TransformContext(config, logger));
        var tree = RobotParser.parse("*** Test Cases ***\nTest\n    ${x}    Set Variable    1\n");
        transformer.visitFile(tree, new FileContext(Path.of("test.robot"), new DisablerResolver().resolve(tree), config, logger, ProblemReporter.NOOP));

        assertThat(RobotRenderer.render(tree)).isEqualTo("*** Test Cases ***\nTest\n    VAR  ${x}  1\n");
    }

    @Test
    void skippedKeywordsAreKept() {
        transformer.skip = List.of("Catenate");

        assertThat(formatStatement("${x}    Catenate    a    b")).isEqualTo("${x}    Catenate    a    b");
        assertThat(formatStatement("${x}    Set Variable    a")).isEqualTo("VAR    ${x}    a");
    }

    @Test
    void unknownSkippedKeywordIsAConfigurationError() {
        transformer.skip = List.of("Log");

        assertThatThrownBy(() -> transformer.beforeRun(new TransformContext(FormattingConfig.DEFAULT, new Logger(null, null, null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Log");
    }

    @Test
    void disabledCallsAreKept() {
        var source = """
                *** Test Cases ***
                Test
                    # robotidy: off=ReplaceWithVAR
                    ${x}    Set Variable    1
                    # robotidy: on=ReplaceWithVAR
                    ${y}    Set Variable    2
                """;

        assertThat(format(source)).isEqualTo("""
                *** Test Cases ***
                Test
                    # robotidy: off=ReplaceWithVAR
                    ${x}    Set Variable    1
                    # robotidy: on=ReplaceWithVAR
                    VAR    ${y}    2
                """);
    }

    @Test
    void callsOutsideTestsAndKeywordsAreNotTouched() {
        var source = """
                *** Settings ***
                Suite Setup    Set Variable    1
                """;

        assertThat(format(source)).isEqualTo(source);
    }

    @Test
    void replacingIsIdempotent() {
        var once = format("""
                *** Test Cases ***
                Test
                    ${x}    Set Variable    1
                    ${d}    Create Dictionary    a    1
                    Set Suite Variable    ${x}    2
                """);

        assertThat(format(once)).isEqualTo(once);
    }

    @Test
    void keepsWindowsLineEndings() {
        assertThat(format("*** Test Cases ***\r\nTest\r\n    ${x}    Set Variable    1    \r\n"))
                .isEqualTo("*** Test Cases ***\r\nTest\r\n    VAR    ${x}    1\r\n");
    }
}
