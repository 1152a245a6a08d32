package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

public enum ErrorSubtype {
    /** The same function is already being analyzed as many times as the depth limit allows. */
    RECURSION,
    /** No analyzable source text could be produced for the function. */
    SOURCE_CLEANING,
    /** The normalized source text is not valid. */
    AST_PARSE,
    /** Lowering completed but logged at least one error. */
    VISITATION,
    /** Lowering completed without errors but produced nothing. */
    NO_RESULT,
    /** Any other failure. */
    UNEXPECTED;

    public static final List<ErrorSubtype> VALUES = List.of(values());

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static @Nullable ErrorSubtype fromJsonName(String jsonName) {
        for (ErrorSubtype subtype : VALUES) {
            if (subtype.jsonName().equals(jsonName))
                return subtype;
        }
        return null;
    }
}
