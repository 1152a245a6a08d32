package it.polimi.ds.ruleir.analyzer.env;

import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;

import java.util.*;

/**
 * Immutable snapshot of the names visible to the function being lowered. Bindings keep insertion order and may
 * be bound to {@code null}, so {@link #contains(String)} has to be used to tell a missing name apart.
 */
public final class Environment {

    public static final Environment EMPTY = new Environment(Map.of());

    private final @Unmodifiable Map<String, @Nullable Object> bindings;

    private Environment(Map<String, @Nullable Object> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static Environment of(Map<String, @Nullable Object> bindings) {
        return EMPTY.layer(bindings);
    }

    /**
     * @return a new environment where {@code bindings} shadow the ones of this environment
     */
    public Environment layer(Map<String, @Nullable Object> bindings) {
        if (bindings.isEmpty())
            return this;

        final Map<String, @Nullable Object> layered = new LinkedHashMap<>(this.bindings);
        layered.putAll(bindings);
        return new Environment(layered);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public @Nullable Object get(String name) {
        return bindings.get(name);
    }

    public @Unmodifiable Set<String> names() {
        return bindings.keySet();
    }

    public @Unmodifiable Map<String, @Nullable Object> asMap() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return this == o || o instanceof Environment that && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Environment" + bindings.keySet();
    }
}
