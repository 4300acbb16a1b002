package net.neoforged.tidy.api.model;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

public enum SectionType {
    SETTINGS(TokenType.SETTING_HEADER),
    VARIABLES(TokenType.VARIABLE_HEADER),
    TEST_CASES(TokenType.TESTCASE_HEADER),
    TASKS(TokenType.TASK_HEADER),
    KEYWORDS(TokenType.KEYWORD_HEADER),
    COMMENTS(TokenType.COMMENT_HEADER),
    INVALID(TokenType.INVALID_HEADER);

    private final TokenType headerType;

    SectionType(TokenType headerType) {
        this.headerType = headerType;
    }

    public TokenType headerType() {
        return headerType;
    }

    /**
     * @return whether the section is made of named blocks (tests, tasks or keywords)
     */
    public boolean hasBlocks() {
        return this == TEST_CASES || this == TASKS || this == KEYWORDS;
    }

    public @Nullable BlockType blockType() {
        return switch (this) {
            case TEST_CASES -> BlockType.TEST_CASE;
            case TASKS -> BlockType.TASK;
            case KEYWORDS -> BlockType.KEYWORD;
            default -> null;
        };
    }

    /**
     * Resolves a header such as {@code *** Test Cases ***}. Singular forms are accepted.
     */
    public static SectionType fromHeader(String header) {
        var name = header.replace("*", "").trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return switch (name) {
            case "settings", "setting" -> SETTINGS;
            case "variables", "variable" -> VARIABLES;
            case "test cases", "test case" -> TEST_CASES;
            case "tasks", "task" -> TASKS;
            case "keywords", "keyword" -> KEYWORDS;
            case "comments", "comment" -> COMMENTS;
            default -> INVALID;
        };
    }
}
