package net.neoforged.tidy.cli;

import net.neoforged.tidy.api.FileEntry;
import net.neoforged.tidy.api.Logger;

import java.util.Locale;

/**
 * Counts the outcome of every file of a run and prints the summary.
 */
class RunReporter {
    private final Logger logger;
    private final boolean check;
    private int reformatted;
    private int unchanged;
    private int skipped;

    RunReporter(Logger logger, boolean check) {
        this.logger = logger;
        this.check = check;
    }

    void record(FileEntry entry, FileOutcome outcome) {
        switch (outcome) {
            case REFORMATTED -> {
                reformatted++;
                if (check) {
                    logger.info("Would reformat %s", entry.path());
                } else {
                    logger.debug("Reformatted %s", entry.path());
                }
            }
            case UNCHANGED -> unchanged++;
            case DISABLED -> {
                unchanged++;
                logger.debug("Skipped %s, all transformers are disabled in it", entry.path());
            }
            case SKIPPED -> skipped++;
        }
    }

    int reformatted() {
        return reformatted;
    }

    int unchanged() {
        return unchanged;
    }

    int skipped() {
        return skipped;
    }

    String summary() {
        return String.format(Locale.ROOT, "%d %s reformatted, %d %s left unchanged. %d %s skipped.",
                reformatted, files(reformatted), unchanged, files(unchanged), skipped, files(skipped));
    }

    void printSummary() {
        logger.info("%s", summary());
    }

    private static String files(int count) {
        return count == 1 ? "file" : "files";
    }
}
