package net.neoforged.tidy.renamevariables;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VariableRenamerTest {
    private static final List<String> NAMES = List.of(
            "simple", "UPPER", "two words", "under_score", "camelCase", "HTTPServer", "mixed_Case Name",
            "trailing_", "  padded  ", "a1B2c3", "x", "ALL CAPS_WITH mixed", "getHTTPResponseCode", "my-var", "item-Name"
    );

    static List<Arguments> conventions() {
        var result = new ArrayList<Arguments>();
        for (var separator : VariableSeparator.values()) {
            for (var nameCase : NameCase.values()) {
                for (var camel : List.of(true, false)) {
                    result.add(Arguments.of(separator, nameCase, camel));
                }
            }
        }
        return result;
    }

    @ParameterizedTest
    @MethodSource("conventions")
    void renamingConverges(VariableSeparator separator, NameCase nameCase, boolean convertCamelCase) {
        var renamer = new VariableRenamer(separator, convertCamelCase, Set.of());

        for (var name : NAMES) {
            var once = renamer.normalizeName(name, nameCase);
            assertThat(renamer.normalizeName(once, nameCase)).as("renaming %s", name).isEqualTo(once);
        }
    }

    @ParameterizedTest
    @MethodSource("conventions")
    void renamedTextConverges(VariableSeparator separator, NameCase nameCase, boolean convertCamelCase) {
        var renamer = new VariableRenamer(separator, convertCamelCase, Set.of());
        VariableRenamer.CaseResolver resolver = name -> nameCase;
        var text = "prefix ${someValue}[${itemKey}] and @{list Items} with ${obj.camelAttr} ${a_${nestedName}}";

        var once = renamer.renameText(text, resolver);

        assertThat(renamer.renameText(once, resolver)).isEqualTo(once);
    }

    @Test
    void textBetweenReferencesIsKept() {
        var renamer = new VariableRenamer(VariableSeparator.UNDERSCORE, true, Set.of());

        assertThat(renamer.renameText("a ${first one} b \\${escaped} c @{Second}[${key}] d", name -> NameCase.UPPER))
                .isEqualTo("a ${FIRST_ONE} b \\${escaped} c @{SECOND}[${KEY}] d");
    }
}
