package it.polimi.ds.ruleir.analyzer.fn;

import org.jspecify.annotations.Nullable;

public record Parameter(String name, boolean hasDefault, @Nullable Object defaultValue) {

    public static Parameter of(String name) {
        return new Parameter(name, false, null);
    }

    public static Parameter withDefault(String name, @Nullable Object defaultValue) {
        return new Parameter(name, true, defaultValue);
    }
}
