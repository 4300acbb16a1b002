package net.neoforged.tidy.api;

import java.util.Objects;

/**
 * Groups related {@link ProblemId problems}, e.g. all problems of one transformer.
 */
public record ProblemGroup(String id, String displayName) {
    public ProblemGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
    }

    public static ProblemGroup create(String id, String displayName) {
        return new ProblemGroup(id, displayName);
    }

    @Override
    public String toString() {
        return id;
    }
}
