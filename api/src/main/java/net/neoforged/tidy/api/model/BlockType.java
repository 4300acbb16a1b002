package net.neoforged.tidy.api.model;

public enum BlockType {
    TEST_CASE,
    TASK,
    KEYWORD
}
