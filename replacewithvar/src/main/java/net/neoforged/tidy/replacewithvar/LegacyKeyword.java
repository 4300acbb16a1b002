package net.neoforged.tidy.replacewithvar;

import org.jetbrains.annotations.Nullable;

/**
 * Keywords that create variables and have an equivalent {@code VAR} form.
 */
enum LegacyKeyword {
    SET_VARIABLE("setvariable", '$', null),
    CATENATE("catenate", '$', null),
    CREATE_LIST("createlist", '@', null),
    CREATE_DICTIONARY("createdictionary", '&', null),
    SET_TEST_VARIABLE("settestvariable", null, "TEST"),
    SET_TASK_VARIABLE("settaskvariable", null, "TASK"),
    SET_SUITE_VARIABLE("setsuitevariable", null, "SUITE"),
    SET_GLOBAL_VARIABLE("setglobalvariable", null, "GLOBAL"),
    SET_LOCAL_VARIABLE("setlocalvariable", null, "LOCAL");

    private final String normalizedName;
    @Nullable
    private final Character identifier;
    @Nullable
    private final String scope;

    LegacyKeyword(String normalizedName, @Nullable Character identifier, @Nullable String scope) {
        this.normalizedName = normalizedName;
        this.identifier = identifier;
        this.scope = scope;
    }

    /**
     * @return the sigil of the created variable, or {@code null} if the name argument decides it
     */
    @Nullable
    Character identifier() {
        return identifier;
    }

    /**
     * @return the {@code scope=} value, or {@code null} for keywords whose result is assigned
     */
    @Nullable
    String scope() {
        return scope;
    }

    boolean isScoped() {
        return scope != null;
    }

    static @Nullable LegacyKeyword byName(String normalizedName) {
        for (var keyword : values()) {
            if (keyword.normalizedName.equals(normalizedName)) {
                return keyword;
            }
        }
        return null;
    }
}
