package net.neoforged.tidy.api;

/**
 * Problems reported by the pipeline itself rather than by a single transformer.
 */
public final class TidyProblems {
    public static final ProblemGroup GROUP = ProblemGroup.create("robot-tidy", "Robot Tidy");

    public static final ProblemId PARSE_FAILURE = ProblemId.create("parse-failure", "File could not be read", GROUP);
    public static final ProblemId WRITE_FAILURE = ProblemId.create("write-failure", "File could not be written", GROUP);
    public static final ProblemId MALFORMED_STATEMENT = ProblemId.create("malformed-statement", "Statement left unchanged", GROUP);
    public static final ProblemId TRANSFORMER_FAILURE = ProblemId.create("transformer-failure", "Transformer failed", GROUP);

    private TidyProblems() {
    }
}
