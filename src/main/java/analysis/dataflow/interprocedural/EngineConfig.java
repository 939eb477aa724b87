package analysis.dataflow.interprocedural;

import analysis.dataflow.FixpointSolver;

/**
 * Settings for an analysis run. Defaults are suitable for a quick run, the command line overrides them.
 */
public class EngineConfig {

    public static final long DEFAULT_TIMEOUT_MILLIS = 60000;
    public static final int DEFAULT_MAX_RETRIES = 1;
    public static final int DEFAULT_WIDENING_THRESHOLD = FixpointSolver.DEFAULT_WIDENING_THRESHOLD;
    public static final int DEFAULT_MAX_NODE_VISITS = FixpointSolver.DEFAULT_MAX_NODE_VISITS;
    public static final int DEFAULT_MAX_SCC_ITERATIONS = 10;

    /**
     * How work items are isolated from each other
     */
    public enum Isolation {
        /**
         * One daemon thread per item in the coordinator's JVM. A timed-out thread cannot be killed and keeps running,
         * so this is only for tests and debugging.
         */
        THREAD,
        /**
         * One worker JVM per slot
         */
        PROCESS
    }

    /**
     * Number of work items analyzed at the same time
     */
    private int workers = 1;
    private Isolation isolation = Isolation.PROCESS;
    /**
     * Wall clock budget for one work item in milliseconds
     */
    private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    /**
     * Number of times a crashed item is tried again before it is given up
     */
    private int maxRetries = DEFAULT_MAX_RETRIES;
    /**
     * Give a timed-out procedure a conservative placeholder summary (otherwise its callers treat it as code-less)
     */
    private boolean substituteOnTimeout = true;
    /**
     * Node visits after which the solver widens instead of joining
     */
    private int wideningThreshold = DEFAULT_WIDENING_THRESHOLD;
    /**
     * Node visits after which the solver freezes a node
     */
    private int maxNodeVisits = DEFAULT_MAX_NODE_VISITS;
    /**
     * Passes over a recursive SCC (work items per member, on average) before the SCC is declared converged
     */
    private int maxSccIterations = DEFAULT_MAX_SCC_ITERATIONS;
    /**
     * Analyses of a member of a recursive SCC after which its new summaries are widened with the previous ones
     */
    private int summaryWideningThreshold = 3;
    /**
     * Fail loudly (AssertionError) on malformed instructions instead of substituting a placeholder
     */
    private boolean strict = false;
    private int outputLevel = 0;

    public int getWorkers() {
        return workers;
    }

    public EngineConfig setWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Need at least one worker, not " + workers);
        }
        this.workers = workers;
        return this;
    }

    public Isolation getIsolation() {
        return isolation;
    }

    public EngineConfig setIsolation(Isolation isolation) {
        this.isolation = isolation;
        return this;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public EngineConfig setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Timeout must be positive, not " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public EngineConfig setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public boolean substituteOnTimeout() {
        return substituteOnTimeout;
    }

    public EngineConfig setSubstituteOnTimeout(boolean substituteOnTimeout) {
        this.substituteOnTimeout = substituteOnTimeout;
        return this;
    }

    public int getWideningThreshold() {
        return wideningThreshold;
    }

    public EngineConfig setWideningThreshold(int wideningThreshold) {
        this.wideningThreshold = wideningThreshold;
        return this;
    }

    public int getMaxNodeVisits() {
        return maxNodeVisits;
    }

    public EngineConfig setMaxNodeVisits(int maxNodeVisits) {
        this.maxNodeVisits = maxNodeVisits;
        return this;
    }

    public int getMaxSccIterations() {
        return maxSccIterations;
    }

    public EngineConfig setMaxSccIterations(int maxSccIterations) {
        this.maxSccIterations = maxSccIterations;
        return this;
    }

    public int getSummaryWideningThreshold() {
        return summaryWideningThreshold;
    }

    public EngineConfig setSummaryWideningThreshold(int summaryWideningThreshold) {
        this.summaryWideningThreshold = summaryWideningThreshold;
        return this;
    }

    public boolean isStrict() {
        return strict;
    }

    public EngineConfig setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public EngineConfig setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig(workers=" + workers + ", isolation=" + isolation + ", timeout=" + timeoutMillis
                + "ms, maxRetries=" + maxRetries + ", wideningThreshold=" + wideningThreshold + ", maxNodeVisits="
                + maxNodeVisits + ", maxSccIterations=" + maxSccIterations + ", strict=" + strict + ")";
    }
}
