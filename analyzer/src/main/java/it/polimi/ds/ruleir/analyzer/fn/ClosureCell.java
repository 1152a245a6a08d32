package it.polimi.ds.ruleir.analyzer.fn;

import it.polimi.ds.ruleir.utils.FastIllegalStateException;
import org.jspecify.annotations.Nullable;

/**
 * A captured variable. Cells start either bound or empty, and an empty cell can be bound later on, which is how
 * helpers that refer to themselves (or to each other) get built.
 */
public final class ClosureCell {

    private final String name;
    private boolean bound;
    private @Nullable Object value;

    private ClosureCell(String name, boolean bound, @Nullable Object value) {
        this.name = name;
        this.bound = bound;
        this.value = value;
    }

    public static ClosureCell of(String name, @Nullable Object value) {
        return new ClosureCell(name, true, value);
    }

    public static ClosureCell empty(String name) {
        return new ClosureCell(name, false, null);
    }

    public String name() {
        return name;
    }

    public boolean isBound() {
        return bound;
    }

    public @Nullable Object get() {
        if (!bound)
            throw new FastIllegalStateException("Closure cell " + name + " is empty");
        return value;
    }

    public void set(@Nullable Object value) {
        this.value = value;
        this.bound = true;
    }

    @Override
    public String toString() {
        return "ClosureCell{" + name + (bound ? "=" + value : " (empty)") + '}';
    }
}
