package work.lcod.twine.runtime;

import java.util.Objects;

/**
 * Execution context shared by the macro components of one passage compile. Owns the live variable
 * store and carries the caller-supplied visit log, randomness and trace sink.
 */
public final class ExecutionContext {
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    private final VariableStore store;
    private final VisitLog visitLog;
    private final TagLookup tagLookup;
    private final RandomSource random;
    private final TraceSink traceSink;
    private final int maxIterations;

    public ExecutionContext(VariableStore store) {
        this(store, VisitLog.empty(), TagLookup.none(), RandomSource.system(), TraceSink.none(), DEFAULT_MAX_ITERATIONS);
    }

    public ExecutionContext(VariableStore store, VisitLog visitLog, TagLookup tagLookup) {
        this(store, visitLog, tagLookup, RandomSource.system(), TraceSink.none(), DEFAULT_MAX_ITERATIONS);
    }

    public ExecutionContext(
        VariableStore store,
        VisitLog visitLog,
        TagLookup tagLookup,
        RandomSource random,
        TraceSink traceSink,
        int maxIterations
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.visitLog = visitLog == null ? VisitLog.empty() : visitLog;
        this.tagLookup = tagLookup == null ? TagLookup.none() : tagLookup;
        this.random = random == null ? RandomSource.system() : random;
        this.traceSink = traceSink == null ? TraceSink.none() : traceSink;
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public VariableStore store() {
        return store;
    }

    public VisitLog visitLog() {
        return visitLog;
    }

    public TagLookup tagLookup() {
        return tagLookup;
    }

    public RandomSource random() {
        return random;
    }

    /**
     * Cap on resolved macros per reduction loop (conditional chains, visited guards).
     */
    public int maxIterations() {
        return maxIterations;
    }

    public void trace(String category, String message) {
        traceSink.trace(category, message);
    }
}
