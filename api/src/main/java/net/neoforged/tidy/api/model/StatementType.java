package net.neoforged.tidy.api.model;

public enum StatementType {
    SECTION_HEADER,
    TESTCASE_NAME,
    KEYWORD_NAME,
    /**
     * {@code [Tags]}, {@code [Setup]} and the other bracketed settings of tests and keywords.
     */
    BLOCK_SETTING,
    /**
     * An entry of the {@code *** Settings ***} section.
     */
    SUITE_SETTING,
    /**
     * An entry of the {@code *** Variables ***} section.
     */
    VARIABLE,
    KEYWORD_CALL,
    TEMPLATE_ARGUMENTS,
    FOR_HEADER,
    IF_HEADER,
    ELSE_IF_HEADER,
    ELSE_HEADER,
    WHILE_HEADER,
    TRY_HEADER,
    EXCEPT_HEADER,
    FINALLY_HEADER,
    END,
    RETURN,
    BREAK,
    CONTINUE,
    VAR,
    COMMENT,
    EMPTY_LINE,
    ERROR
}
