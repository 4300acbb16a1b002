package net.neoforged.tidy.renamevariables;

import net.neoforged.tidy.api.variables.VariableMatch;
import net.neoforged.tidy.api.variables.VariableNames;
import net.neoforged.tidy.api.variables.VariableSearcher;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites the variable references in a piece of text.
 * <p>
 * Only the name part of a reference changes. The text following the name inside the braces (attribute access,
 * method calls, math) and item access are kept, but references inside them are renamed too.
 */
final class VariableRenamer {
    private static final Pattern CAMEL_CASE = Pattern.compile("((?<=[a-z0-9])[A-Z]|(?<=[^ _-])[A-Z](?=[a-z]))");
    private static final String NAME_DELIMITERS = ".[(+-*/";

    /**
     * Chooses the case of a variable from its normalized name.
     */
    @FunctionalInterface
    interface CaseResolver {
        NameCase caseOf(String normalizedName);
    }

    private final VariableSeparator separator;
    private final boolean convertCamelCase;
    private final Set<String> ignored;

    /**
     * @param ignored normalized names that are never renamed
     */
    VariableRenamer(VariableSeparator separator, boolean convertCamelCase, Set<String> ignored) {
        this.separator = separator;
        this.convertCamelCase = convertCamelCase;
        this.ignored = Set.copyOf(ignored);
    }

    String renameText(String text, CaseResolver resolver) {
        var result = new StringBuilder(text.length());
        int pos = 0;
        for (var match : VariableSearcher.findAll(text)) {
            result.append(text, pos, match.start());
            result.append(renameVariable(match, resolver));
            pos = match.end();
        }
        result.append(text, pos, text.length());
        return result.toString();
    }

    String renameVariable(VariableMatch match, CaseResolver resolver) {
        if (match.isInlineEvaluation() || match.base().startsWith("\\")) {
            return match.toString();
        }
        var items = new ArrayList<String>(match.items().size());
        for (var item : match.items()) {
            items.add(renameText(item, resolver));
        }
        if (match.isEnvironment()) {
            return match.format(renameText(match.base(), resolver), items);
        }

        var base = match.base();
        int nameEnd = nameEnd(base);
        var name = base.substring(0, nameEnd);
        var rest = base.substring(nameEnd);
        return match.format(renameName(name, rest.isEmpty(), resolver) + renameText(rest, resolver), items);
    }

    private String renameName(String name, boolean wholeBase, CaseResolver resolver) {
        if (VariableSearcher.search(name, 0) != null) {
            // dynamic names keep their literal text
            return renameText(name, resolver);
        }
        var core = name.strip();
        var normalized = VariableNames.normalize(core);
        if (core.isEmpty() || ignored.contains(normalized)) {
            return name;
        }
        var renamed = normalizeName(core, resolver.caseOf(normalized));
        if (wholeBase) {
            return renamed;
        }
        // "${SPACE * 4}" keeps the space in front of the operator
        return renamed + name.substring(name.stripTrailing().length());
    }

    String normalizeName(String name, NameCase nameCase) {
        var result = name;
        if (convertCamelCase && hasLowerAndUpperCase(result)) {
            result = CAMEL_CASE.matcher(result).replaceAll(" $1");
        }
        result = separator.apply(result);
        return nameCase.apply(result);
    }

    /**
     * @return the normalized name a reference defines, or {@code null} if the reference has a dynamic name
     */
    static @Nullable String definedName(VariableMatch match) {
        if (match.isInlineEvaluation() || match.isEnvironment()) {
            return null;
        }
        var base = match.base();
        var name = base.substring(0, nameEnd(base));
        if (VariableSearcher.search(name, 0) != null || name.isBlank()) {
            return null;
        }
        return VariableNames.normalize(name);
    }

    private static boolean hasLowerAndUpperCase(String name) {
        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            lower |= Character.isLowerCase(c);
            upper |= Character.isUpperCase(c);
        }
        return lower && upper;
    }

    /**
     * A {@code -} followed by a letter is part of the name, as in {@code ${my-var}}. Otherwise it is subtraction,
     * as in {@code ${count-1}}.
     */
    private static boolean isNameHyphen(String base, int index) {
        if (base.charAt(index) != '-' || index + 1 >= base.length()) {
            return false;
        }
        char next = base.charAt(index + 1);
        return Character.isLetter(next) || next == '_';
    }

    /**
     * Finds where the name part of a base ends: at the first delimiter that is not inside a nested reference.
     */
    private static int nameEnd(String base) {
        int i = 0;
        while (i < base.length()) {
            char c = base.charAt(i);
            if ("$@&%".indexOf(c) >= 0 && i + 1 < base.length() && base.charAt(i + 1) == '{') {
                var nested = VariableSearcher.search(base, i);
                if (nested != null && nested.start() == i) {
                    i = nested.end();
                    continue;
                }
            }
            if (NAME_DELIMITERS.indexOf(c) >= 0 && !isNameHyphen(base, i)) {
                return i;
            }
            i++;
        }
        return base.length();
    }
}
