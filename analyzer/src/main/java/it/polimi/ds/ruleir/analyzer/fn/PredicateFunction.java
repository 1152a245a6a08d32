package it.polimi.ds.ruleir.analyzer.fn;

import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A predicate function handed over by the embedding layer.
 * <p>
 * Implementations must not override {@link Object#equals(Object)}: the identity of the instance is what the
 * recursion guard counts.
 */
public interface PredicateFunction {

    String name();

    /**
     * @return the file the function is declared in, if known
     */
    @Nullable Path file();

    /**
     * @return 1-based line the declaration starts at in {@link #file()}
     */
    int startLine();

    /**
     * @return the whole declared source text, used when the declaration cannot be found in {@link #file()}
     */
    @Nullable String sourceText();

    @Unmodifiable List<Parameter> parameters();

    @Unmodifiable List<ClosureCell> closure();

    @Unmodifiable Map<String, @Nullable Object> globals();

    /**
     * @return the instance the function is bound to, for bound methods
     */
    @Nullable Object receiver();
}
