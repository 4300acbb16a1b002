package net.neoforged.tidy.cli;

public enum ListFilter {
    ALL,
    ENABLED,
    DISABLED
}
