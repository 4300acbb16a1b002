package net.neoforged.tidy.replacewithvar;

import net.neoforged.tidy.api.variables.VariableMatch;
import net.neoforged.tidy.api.variables.VariableSearcher;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts the cells of a legacy keyword call into a {@code VAR} statement.
 * <p>
 * Every method returns {@code null} when the call cannot be expressed as {@code VAR} without changing what it does.
 * Such calls are left as they are.
 */
final class VarConverter {
    private static final String SEPARATOR_ARGUMENT = "SEPARATOR=";
    private static final String CHILDREN_OPTION = "children=";

    @Nullable
    VarForm convert(LegacyKeyword keyword, List<String> assigns, List<String> arguments) {
        var form = convertCall(keyword, assigns, arguments);
        if (form == null) {
            return null;
        }
        // VAR would read these values as its own options
        for (var value : form.values()) {
            if (looksLikeVarOption(value)) {
                return null;
            }
        }
        return form;
    }

    private @Nullable VarForm convertCall(LegacyKeyword keyword, List<String> assigns, List<String> arguments) {
        if (keyword.isScoped()) {
            return assigns.isEmpty() ? convertScoped(keyword, arguments) : null;
        }
        if (assigns.size() != 1) {
            return null;
        }
        var target = VariableSearcher.matchWhole(VariableSearcher.stripAssignMark(assigns.get(0)));
        if (target == null || !target.items().isEmpty() || target.isEnvironment() || target.isInlineEvaluation()) {
            return null;
        }
        char identifier = keyword.identifier();
        // a list or dictionary assigned from Set Variable or Catenate would become a scalar
        if (identifier == '$' && !target.isScalar()) {
            return null;
        }
        var variable = identifier + "{" + target.base() + "}";

        return switch (keyword) {
            case SET_VARIABLE -> convertSetVariable(variable, arguments);
            case CATENATE -> convertCatenate(variable, arguments);
            case CREATE_LIST -> new VarForm(variable, arguments, List.of());
            case CREATE_DICTIONARY -> convertCreateDictionary(variable, arguments);
            default -> null;
        };
    }

    private static @Nullable VarForm convertSetVariable(String variable, List<String> arguments) {
        if (arguments.size() > 1) {
            return null;
        }
        if (arguments.size() == 1) {
            var match = VariableSearcher.matchWhole(arguments.get(0));
            if (match != null && match.isList() && match.items().isEmpty()) {
                return null;
            }
        }
        return new VarForm(variable, arguments, List.of());
    }

    private static VarForm convertCatenate(String variable, List<String> arguments) {
        if (arguments.isEmpty() || !arguments.get(0).startsWith(SEPARATOR_ARGUMENT)) {
            return new VarForm(variable, arguments, List.of());
        }
        var separator = arguments.get(0).substring(SEPARATOR_ARGUMENT.length());
        var option = "separator=" + (separator.isEmpty() ? "${EMPTY}" : separator);
        return new VarForm(variable, arguments.subList(1, arguments.size()), List.of(option));
    }

    /**
     * Positional arguments come first and pair up as keys and values. After them only {@code key=value} items and
     * dictionaries such as {@code &{defaults}} may follow.
     */
    private static @Nullable VarForm convertCreateDictionary(String variable, List<String> arguments) {
        int positional = 0;
        while (positional < arguments.size() && !isNamedItem(arguments.get(positional)) && !isDictionary(arguments.get(positional))) {
            if (isList(arguments.get(positional))) {
                return null;
            }
            positional++;
        }
        if (positional % 2 != 0) {
            return null;
        }
        var items = new ArrayList<String>(arguments.size());
        for (int i = 0; i < positional; i += 2) {
            items.add(arguments.get(i) + "=" + arguments.get(i + 1));
        }
        for (int i = positional; i < arguments.size(); i++) {
            var argument = arguments.get(i);
            if (!isNamedItem(argument) && !isDictionary(argument)) {
                return null;
            }
            items.add(argument);
        }
        return new VarForm(variable, items, List.of());
    }

    private static @Nullable VarForm convertScoped(LegacyKeyword keyword, List<String> arguments) {
        if (arguments.size() < 2) {
            return null;
        }
        var target = parseName(arguments.get(0));
        if (target == null) {
            return null;
        }
        var values = arguments.subList(1, arguments.size());
        for (var value : values) {
            if (value.startsWith(CHILDREN_OPTION)) {
                return null;
            }
        }
        if (target.isScalar() && values.size() > 1) {
            return null;
        }
        return new VarForm(target.name(), values, List.of("scope=" + keyword.scope()));
    }

    /**
     * Accepts {@code ${name}}, {@code \${name}} and {@code $name}.
     */
    private static @Nullable VariableMatch parseName(String name) {
        var text = name.startsWith("\\") ? name.substring(1) : name;
        if (text.length() > 1 && "$@&".indexOf(text.charAt(0)) >= 0 && text.charAt(1) != '{') {
            text = text.charAt(0) + "{" + text.substring(1) + "}";
        }
        var match = VariableSearcher.matchWhole(text);
        if (match == null || match.isEnvironment() || match.isInlineEvaluation() || !match.items().isEmpty() || match.base().isBlank()) {
            return null;
        }
        return match;
    }

    private static boolean looksLikeVarOption(String argument) {
        var lower = argument.toLowerCase(Locale.ROOT);
        return lower.startsWith("scope=") || lower.startsWith("separator=");
    }

    /**
     * @return whether the argument contains an unescaped {@code =} outside of variables
     */
    static boolean isNamedItem(String argument) {
        int i = 0;
        while (i < argument.length()) {
            char c = argument.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if ("$@&%".indexOf(c) >= 0 && i + 1 < argument.length() && argument.charAt(i + 1) == '{') {
                var match = VariableSearcher.search(argument, i);
                if (match != null && match.start() == i) {
                    i = match.end();
                    continue;
                }
            }
            if (c == '=') {
                return i > 0;
            }
            i++;
        }
        return false;
    }

    private static boolean isDictionary(String argument) {
        var match = VariableSearcher.matchWhole(argument);
        return match != null && match.isDict() && match.items().isEmpty();
    }

    private static boolean isList(String argument) {
        var match = VariableSearcher.matchWhole(argument);
        return match != null && match.isList() && match.items().isEmpty();
    }
}
