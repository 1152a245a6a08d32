package it.polimi.ds.ruleir.analyzer;

import com.google.errorprone.annotations.MustBeClosed;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.utils.FastIllegalStateException;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Counts, per function instance, how many analyses of it are in progress.
 * <p>
 * A single guard is shared by an analysis and every helper it inlines, so it is not thread-safe: concurrent
 * analyses each need their own.
 */
public final class RecursionGuard {

    public static final int DEFAULT_LIMIT = 3;

    private final int limit;
    private final Map<PredicateFunction, Integer> inProgress = new IdentityHashMap<>();

    public RecursionGuard() {
        this(DEFAULT_LIMIT);
    }

    public RecursionGuard(int limit) {
        if (limit < 1)
            throw new IllegalArgumentException("Recursion limit must be at least 1, got " + limit);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    public int count(PredicateFunction fn) {
        return inProgress.getOrDefault(fn, 0);
    }

    public boolean isAtLimit(PredicateFunction fn) {
        return count(fn) >= limit;
    }

    public boolean isEmpty() {
        return inProgress.isEmpty();
    }

    /**
     * Marks one more analysis of {@code fn} as in progress, until the returned scope is closed.
     *
     * @throws IllegalStateException if {@code fn} is already at the limit
     */
    @MustBeClosed
    public Scope enter(PredicateFunction fn) {
        final int count = count(fn);
        if (count >= limit)
            throw new FastIllegalStateException("Function " + fn.name() + " is already being analyzed " +
                    count + " times");
        inProgress.put(fn, count + 1);
        return new Scope(fn);
    }

    public final class Scope implements AutoCloseable {

        private final PredicateFunction fn;
        private boolean closed;

        private Scope(PredicateFunction fn) {
            this.fn = fn;
        }

        @Override
        public void close() {
            if (closed)
                return;
            closed = true;

            final int count = count(fn) - 1;
            if (count <= 0)
                inProgress.remove(fn);
            else
                inProgress.put(fn, count);
        }
    }
}
