package it.polimi.ds.ruleir.analyzer.fn;

import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.*;

/**
 * {@link PredicateFunction} described by its source text and the values it captured.
 */
public final class SourcePredicate implements PredicateFunction {

    private final String name;
    private final @Nullable Path file;
    private final int startLine;
    private final @Nullable String sourceText;
    private final @Unmodifiable List<Parameter> parameters;
    private final @Unmodifiable List<ClosureCell> closure;
    private final @Unmodifiable Map<String, @Nullable Object> globals;
    private final @Nullable Object receiver;

    private SourcePredicate(Builder builder) {
        this.name = builder.name;
        this.file = builder.file;
        this.startLine = builder.startLine;
        this.sourceText = builder.sourceText;
        this.parameters = List.copyOf(builder.parameters);
        this.closure = List.copyOf(builder.closure);
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globals));
        this.receiver = builder.receiver;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public @Nullable Path file() {
        return file;
    }

    @Override
    public int startLine() {
        return startLine;
    }

    @Override
    public @Nullable String sourceText() {
        return sourceText;
    }

    @Override
    public @Unmodifiable List<Parameter> parameters() {
        return parameters;
    }

    @Override
    public @Unmodifiable List<ClosureCell> closure() {
        return closure;
    }

    @Override
    public @Unmodifiable Map<String, @Nullable Object> globals() {
        return globals;
    }

    @Override
    public @Nullable Object receiver() {
        return receiver;
    }

    @Override
    public String toString() {
        return "SourcePredicate{" + name + (file != null ? " at " + file + ':' + startLine : "") + '}';
    }

    public static final class Builder {

        private final String name;
        private @Nullable Path file;
        private int startLine = 1;
        private @Nullable String sourceText;
        private final List<Parameter> parameters = new ArrayList<>();
        private final List<ClosureCell> closure = new ArrayList<>();
        private final Map<String, @Nullable Object> globals = new LinkedHashMap<>();
        private @Nullable Object receiver;

        private Builder(String name) {
            this.name = name;
        }

        public Builder file(Path file, int startLine) {
            this.file = file;
            this.startLine = startLine;
            return this;
        }

        public Builder source(String sourceText) {
            this.sourceText = sourceText;
            return this;
        }

        public Builder parameters(String... names) {
            for (String parameter : names)
                parameters.add(Parameter.of(parameter));
            return this;
        }

        public Builder parameter(Parameter parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder capture(String name, @Nullable Object value) {
            closure.add(ClosureCell.of(name, value));
            return this;
        }

        public Builder capture(ClosureCell cell) {
            closure.add(cell);
            return this;
        }

        public Builder global(String name, @Nullable Object value) {
            globals.put(name, value);
            return this;
        }

        public Builder receiver(Object receiver) {
            this.receiver = receiver;
            return this;
        }

        public SourcePredicate build() {
            if (file == null && sourceText == null)
                throw new IllegalStateException("Predicate " + name + " needs either a file or its source text");
            return new SourcePredicate(this);
        }
    }
}
