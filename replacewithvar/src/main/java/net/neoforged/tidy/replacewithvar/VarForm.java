package net.neoforged.tidy.replacewithvar;

import java.util.List;

/**
 * The cells of a {@code VAR} statement following {@code VAR} itself.
 *
 * @param variable the created variable, e.g. {@code ${name}}
 * @param values   the values, in order
 * @param options  {@code scope=} and {@code separator=} options, written after the values
 */
record VarForm(String variable, List<String> values, List<String> options) {
    VarForm {
        values = List.copyOf(values);
        options = List.copyOf(options);
    }
}
