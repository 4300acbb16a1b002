package net.neoforged.tidy.api.disablers;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A {@code # robotidy: on} or {@code # robotidy: off=Name1, Name2} comment.
 *
 * @param off     {@code true} for {@code off}, {@code false} for {@code on}
 * @param targets the transformer names the directive applies to, or {@link #ALL}
 */
public record DisablerDirective(boolean off, List<String> targets) {
    public static final String ALL = "all";

    private static final Pattern PATTERN = Pattern.compile("\\s*#\\s?robotidy:\\s?(?<disabler>on|off) ?=?(?<transformers>[\\w,\\s]*)");

    public DisablerDirective {
        targets = List.copyOf(targets);
    }

    /**
     * Parses the text of a comment token.
     *
     * @return the directive, or {@code null} if the comment is not one
     */
    public static @Nullable DisablerDirective parse(@Nullable String comment) {
        if (comment == null || comment.isEmpty()) {
            return null;
        }
        var matcher = PATTERN.matcher(comment);
        if (!matcher.lookingAt()) {
            return null;
        }
        boolean off = matcher.group("disabler").equals("off");
        var transformers = matcher.group("transformers");
        // "# robotidy: off some text" disables everything, names are only read after '='
        if (transformers == null || transformers.isEmpty() || !matcher.group().contains("=")) {
            return new DisablerDirective(off, List.of(ALL));
        }
        var targets = new ArrayList<String>();
        for (var name : transformers.split(",")) {
            var trimmed = name.strip();
            if (!trimmed.isEmpty()) {
                targets.add(trimmed);
            }
        }
        return new DisablerDirective(off, targets);
    }
}
