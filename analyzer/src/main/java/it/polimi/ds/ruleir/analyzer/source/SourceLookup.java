package it.polimi.ds.ruleir.analyzer.source;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of looking up the source of a function: either its text or the reason there is none.
 */
public record SourceLookup(@Nullable String text, @Nullable String failure) {

    public SourceLookup {
        if ((text == null) == (failure == null))
            throw new IllegalArgumentException("Exactly one of text and failure must be set");
    }

    public static SourceLookup found(String text) {
        return new SourceLookup(text, null);
    }

    public static SourceLookup failed(String failure) {
        return new SourceLookup(null, failure);
    }

    public boolean isFound() {
        return text != null;
    }
}
