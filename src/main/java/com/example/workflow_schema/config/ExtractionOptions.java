package com.example.workflow_schema.config;

/**
 * Bounds applied while enumerating paths and folding them into execution states.
 */
public final class ExtractionOptions {

    public static final int DEFAULT_MAX_PATHS = 60;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 2;
    public static final int DEFAULT_MAX_DEPTH = 300;
    public static final int DEFAULT_MAX_EXPANSIONS = 200_000;

    /** Cap on unique paths kept per record and on combinations tried per split. */
    private int maxPaths = DEFAULT_MAX_PATHS;
    /** How often one node may be entered along a single path. */
    private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
    /** Nodes entered along one walk before the path is closed where it stands. */
    private int maxDepth = DEFAULT_MAX_DEPTH;
    /** Node visits per record; once spent, forks follow only their first outgoing flow. */
    private int maxExpansions = DEFAULT_MAX_EXPANSIONS;

    public ExtractionOptions() {}

    public ExtractionOptions maxPaths(int v) { this.maxPaths = Math.max(1, v); return this; }
    public ExtractionOptions maxLoopIterations(int v) { this.maxLoopIterations = Math.max(1, v); return this; }
    public ExtractionOptions maxDepth(int v) { this.maxDepth = Math.max(1, v); return this; }
    public ExtractionOptions maxExpansions(int v) { this.maxExpansions = Math.max(1, v); return this; }

    public int getMaxPaths() { return maxPaths; }
    public int getMaxLoopIterations() { return maxLoopIterations; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxExpansions() { return maxExpansions; }

    @Override
    public String toString() {
        return "ExtractionOptions{maxPaths=" + maxPaths + ", maxLoopIterations=" + maxLoopIterations
                + ", maxDepth=" + maxDepth + ", maxExpansions=" + maxExpansions + '}';
    }
}
