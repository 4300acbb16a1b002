package net.neoforged.tidy.api.disablers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Disabled line ranges of a single disabler target.
 */
final class DisabledLines {
    record Range(int startLine, int endLine) {
        boolean contains(int start, int end) {
            return startLine <= start && end <= endLine;
        }
    }

    private final List<Range> ranges = new ArrayList<>();
    private boolean wholeFile;

    void add(int startLine, int endLine) {
        ranges.add(new Range(startLine, endLine));
    }

    void disableWholeFile() {
        wholeFile = true;
    }

    boolean isWholeFile() {
        return wholeFile;
    }

    void sort() {
        ranges.sort(Comparator.comparingInt(Range::startLine));
    }

    boolean isDisabled(int startLine, int endLine) {
        if (wholeFile) {
            return true;
        }
        int end = Math.max(startLine, endLine);
        for (var range : ranges) {
            if (range.startLine() > startLine) {
                break;
            }
            if (range.contains(startLine, end)) {
                return true;
            }
        }
        return false;
    }

    List<Range> ranges() {
        return ranges;
    }
}
