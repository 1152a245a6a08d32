package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

public record ErrorLogEntry(String message, @Nullable String trace) {

    public ErrorLogEntry(String message) {
        this(message, null);
    }
}
