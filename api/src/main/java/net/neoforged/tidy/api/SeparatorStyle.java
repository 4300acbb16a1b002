package net.neoforged.tidy.api;

public enum SeparatorStyle {
    SPACE,
    TAB
}
