package net.neoforged.tidy.api.variables;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds variable references in text the way Robot Framework does.
 * <p>
 * A backslash escapes the character following it, so {@code \${name}} is not a reference. Braces nest, so the whole of
 * <code>${outer_${inner}}</code> is one reference whose base contains another one.
 */
public final class VariableSearcher {
    private static final String IDENTIFIERS = "$@&%";
    private static final String ITEM_ACCESS_IDENTIFIERS = "$@&";

    private VariableSearcher() {
    }

    /**
     * @return the first reference starting at or after {@code from}, or {@code null} if there is none
     */
    public static @Nullable VariableMatch search(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (IDENTIFIERS.indexOf(c) >= 0 && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                int close = findClosing(text, i + 1, '{', '}');
                if (close < 0) {
                    return null;
                }
                var items = new ArrayList<String>();
                int end = close + 1;
                if (ITEM_ACCESS_IDENTIFIERS.indexOf(c) >= 0) {
                    while (end < text.length() && text.charAt(end) == '[') {
                        int itemClose = findClosing(text, end, '[', ']');
                        if (itemClose < 0) {
                            break;
                        }
                        items.add(text.substring(end + 1, itemClose));
                        end = itemClose + 1;
                    }
                }
                return new VariableMatch(i, end, c, text.substring(i + 2, close), items);
            }
            i++;
        }
        return null;
    }

    /**
     * @return all top-level references in the text, in order. Nested references are part of their parent's base.
     */
    public static List<VariableMatch> findAll(String text) {
        var result = new ArrayList<VariableMatch>();
        int from = 0;
        VariableMatch match;
        while ((match = search(text, from)) != null) {
            result.add(match);
            from = match.end();
        }
        return result;
    }

    /**
     * @return the reference if the whole text is exactly one reference, otherwise {@code null}
     */
    public static @Nullable VariableMatch matchWhole(String text) {
        var match = search(text, 0);
        if (match != null && match.start() == 0 && match.end() == text.length()) {
            return match;
        }
        return null;
    }

    /**
     * Checks if a keyword call cell assigns a variable, e.g. {@code ${result}=}, {@code @{items}} or
     * {@code ${dict}[key] =}.
     */
    public static boolean isAssign(String text) {
        var match = matchWhole(stripAssignMark(text));
        return match != null && !match.isEnvironment() && !match.base().isEmpty();
    }

    /**
     * Removes a trailing {@code =}, optionally preceded by a single space, from an assignment target.
     */
    public static String stripAssignMark(String text) {
        if (text.endsWith(" =")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("=")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }

    private static int findClosing(String text, int openIndex, char open, char close) {
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }
}
