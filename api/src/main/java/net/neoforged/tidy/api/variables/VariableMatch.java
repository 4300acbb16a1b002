package net.neoforged.tidy.api.variables;

import java.util.List;

/**
 * A variable reference found inside a piece of text, such as {@code ${name}}, {@code @{list}[0]} or
 * {@code %{HOME}}.
 *
 * @param start      index of the sigil in the searched text
 * @param end        index just after the closing brace or the last item access
 * @param identifier the sigil: {@code $}, {@code @}, {@code &} or {@code %}
 * @param base       the text between the braces, which may contain nested references
 * @param items      the contents of each {@code [...]} item access following the reference
 */
public record VariableMatch(int start, int end, char identifier, String base, List<String> items) {
    public VariableMatch {
        items = List.copyOf(items);
    }

    public boolean isScalar() {
        return identifier == '$';
    }

    public boolean isList() {
        return identifier == '@';
    }

    public boolean isDict() {
        return identifier == '&';
    }

    public boolean isEnvironment() {
        return identifier == '%';
    }

    /**
     * @return whether the base is an inline Python evaluation such as <code>${{ 1 + 2 }}</code>
     */
    public boolean isInlineEvaluation() {
        return base.startsWith("{") && base.endsWith("}");
    }

    /**
     * @return the reference without item access, e.g. {@code ${name}}
     */
    public String name() {
        return identifier + "{" + base + "}";
    }

    /**
     * Formats a reference with the same sigil and a different base and items.
     */
    public String format(String newBase, List<String> newItems) {
        var builder = new StringBuilder();
        builder.append(identifier).append('{').append(newBase).append('}');
        for (var item : newItems) {
            builder.append('[').append(item).append(']');
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return format(base, items);
    }
}
