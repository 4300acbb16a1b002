package net.neoforged.tidy.api.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of a {@link Token}. Names follow the token types of the Robot Framework parser.
 */
public enum TokenType {
    SETTING_HEADER,
    VARIABLE_HEADER,
    TESTCASE_HEADER,
    TASK_HEADER,
    KEYWORD_HEADER,
    COMMENT_HEADER,
    INVALID_HEADER,

    TESTCASE_NAME,
    KEYWORD_NAME,

    // Settings section
    DOCUMENTATION,
    SUITE_NAME,
    METADATA,
    SUITE_SETUP,
    SUITE_TEARDOWN,
    TEST_SETUP,
    TEST_TEARDOWN,
    TEST_TEMPLATE,
    TEST_TIMEOUT,
    TEST_TAGS,
    DEFAULT_TAGS,
    KEYWORD_TAGS,
    LIBRARY,
    RESOURCE,
    VARIABLES,

    // Test case and keyword settings
    SETUP,
    TEARDOWN,
    TEMPLATE,
    TIMEOUT,
    TAGS,
    ARGUMENTS,
    RETURN_SETTING,

    NAME,
    WITH_NAME,
    VARIABLE,
    ARGUMENT,
    ASSIGN,
    KEYWORD,
    OPTION,

    FOR,
    FOR_SEPARATOR,
    END,
    IF,
    ELSE_IF,
    ELSE,
    WHILE,
    TRY,
    EXCEPT,
    FINALLY,
    RETURN_STATEMENT,
    BREAK,
    CONTINUE,
    VAR,

    SEPARATOR,
    COMMENT,
    CONTINUATION,
    EOL,
    ERROR;

    private static final Set<TokenType> NON_DATA = EnumSet.of(SEPARATOR, COMMENT, CONTINUATION, EOL);
    private static final Set<TokenType> HEADERS = EnumSet.of(SETTING_HEADER, VARIABLE_HEADER, TESTCASE_HEADER, TASK_HEADER,
            KEYWORD_HEADER, COMMENT_HEADER, INVALID_HEADER);

    /**
     * @return {@code false} for whitespace, comments, continuation markers and line ends
     */
    public boolean isData() {
        return !NON_DATA.contains(this);
    }

    public boolean isHeader() {
        return HEADERS.contains(this);
    }
}
