package analysis.dataflow.interprocedural;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import analysis.callgraph.CallGraph;
import analysis.dataflow.AbstractDomain;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.Checker;
import analysis.dataflow.Issue;
import analysis.executor.WorkCompletion;
import analysis.executor.WorkRequest;
import analysis.executor.WorkResult;
import analysis.executor.WorkerPool;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.summary.CacheEntry;
import analysis.summary.FreshnessKey;
import analysis.summary.Summary;
import analysis.summary.SummaryCache;
import analysis.summary.SummaryStatus;

/**
 * Drives an analysis run: hands ready work from the {@link Scheduler} to the {@link WorkerPool}, writes the summaries
 * that come back to the {@link SummaryCache}, and substitutes conservative placeholder summaries for procedures whose
 * analysis failed so that the rest of the run can go on.
 * <p>
 * The coordinator is the only writer of the cache.
 *
 * @param <D>
 *            data-flow fact
 * @param <S>
 *            summary payload
 */
public final class Coordinator<D, S> {

    /**
     * How long to block waiting for a completion before checking the scheduler again
     */
    private static final long POLL_MILLIS = 200;

    private final CallGraph cg;
    private final AbstractDomain<D, S> domain;
    private final SummaryCache<S> cache;
    private final WorkerPool<S> pool;
    private final EngineConfig config;
    private final int outputLevel;

    private Scheduler scheduler;
    private final Map<ProcedureId, ProcedureOutcome> outcomes = new TreeMap<>();
    /**
     * Key each in-flight procedure is being analyzed against
     */
    private final Map<ProcedureId, FreshnessKey> pendingKeys = new HashMap<>();
    /**
     * Procedures that got a summary (real or placeholder) in this run
     */
    private final Set<ProcedureId> summarizedThisRun = new HashSet<>();
    private int completedItems = 0;

    public Coordinator(CallGraph cg, Checker<D, S> checker, SummaryCache<S> cache, WorkerPool<S> pool,
                       EngineConfig config) {
        this.cg = cg;
        this.domain = checker.getDomain();
        this.cache = cache;
        this.pool = pool;
        this.config = config;
        this.outputLevel = config.getOutputLevel();
    }

    /**
     * Analyze every procedure in the call graph, bottom-up. The worker pool is shut down when the run ends.
     *
     * @return report with the outcome of each procedure
     * @throws InterruptedException
     *             if the coordinator thread is interrupted
     * @throws AssertionError
     *             in strict mode, if some procedure has a malformed instruction
     */
    public RunReport run() throws InterruptedException {
        long start = System.currentTimeMillis();
        if (outputLevel >= 1) {
            System.err.println("ANALYZING " + cg + " with " + config);
        }
        scheduler = new Scheduler(cg, cache, config);
        try {
            recordCacheHits();
            while (!scheduler.isFinished()) {
                for (WorkItem item : scheduler.readyWork()) {
                    pool.submit(buildRequest(item));
                }
                recordCacheHits();
                if (scheduler.isFinished()) {
                    break;
                }
                if (!scheduler.hasInFlight()) {
                    throw new RuntimeException("Nothing in flight and no work ready, but the run is not finished");
                }
                WorkCompletion<S> c = pool.poll(POLL_MILLIS);
                if (c == null) {
                    continue;
                }
                handle(c);
                recordForced();
                recordCacheHits();
            }
        }
        finally {
            pool.shutdown();
        }
        // members of recursive SCCs that were fresh and never needed another analysis
        for (ProcedureId id : cg.getProcedures()) {
            if (!outcomes.containsKey(id)) {
                CacheEntry<S> e = cache.latest(id);
                assert e != null : "No summary and no outcome for " + id;
                outcomes.put(id, new ProcedureOutcome(id, e.getSummary().getStatus(), e.getIssues(), true, null));
            }
        }
        RunReport report = new RunReport(outcomes, cache.getStatistics(), scheduler.getTotalItems(),
                                         System.currentTimeMillis() - start);
        if (outputLevel >= 1) {
            System.err.println(report);
            System.err.println("CACHE: " + cache.getStatistics());
        }
        return report;
    }

    private WorkRequest<S> buildRequest(WorkItem item) {
        ProcedureId id = item.getProcedure();
        ProcedureDescriptor pd = cg.getDescriptor(id);
        Map<ProcedureId, S> summaries = new LinkedHashMap<>();
        Map<ProcedureId, String> hashes = new TreeMap<>();
        for (ProcedureId callee : cg.getCallees(id)) {
            CacheEntry<S> e = visible(callee);
            if (e == null && scheduler.hasFailed(callee)) {
                // timed out in this SCC without a placeholder: assume nothing rather than no return
                summaries.put(callee, domain.conservativeSummary(callee, cg.getDescriptor(callee).getFormals().size()));
                hashes.put(callee, FreshnessKey.MISSING);
            }
            else if (e == null) {
                hashes.put(callee, FreshnessKey.MISSING);
            }
            else {
                summaries.put(callee, e.getSummary().getPayload());
                hashes.put(callee, e.getSummary().getHash());
            }
        }
        for (ProcedureId ext : cg.getExternalCallees(id)) {
            hashes.put(ext, FreshnessKey.EXTERNAL);
        }
        pendingKeys.put(id, new FreshnessKey(pd.codeHash(), hashes));

        S previous = null;
        if (item.widenSummaries()) {
            CacheEntry<S> prev = visible(id);
            previous = prev == null ? null : prev.getSummary().getPayload();
        }
        if (outputLevel >= 2) {
            System.err.println("SUBMIT " + item + " with " + summaries.size() + " callee summaries");
        }
        return new WorkRequest<>(item, pd, new CalleeSummaries<>(summaries, cg.getScc(id).getMembers()), previous);
    }

    /**
     * Summary callers may use in this run: one computed in this run, or one that was fresh when its SCC became ready.
     * Stale stored summaries are never used.
     */
    private CacheEntry<S> visible(ProcedureId id) {
        if (summarizedThisRun.contains(id) || scheduler.wasFreshAtRelease(id)) {
            return cache.latest(id);
        }
        return null;
    }

    private void handle(WorkCompletion<S> c) {
        WorkItem item = c.getItem();
        ProcedureId id = item.getProcedure();
        completedItems++;
        if (outputLevel >= 2) {
            System.err.println("COMPLETED " + c);
        }
        else if (outputLevel >= 1 && completedItems % 100 == 0) {
            System.err.println("Completed " + completedItems + " work items");
        }

        if (c.isSuccess()) {
            WorkResult<S> r = c.getResult();
            Summary<S> s = Summary.create(id, pendingKeys.remove(id), r.getStatus(), r.getPayload(), domain.codec());
            CacheEntry<S> prev = visible(id);
            boolean changed = prev == null || !s.sameContent(prev.getSummary());
            cache.put(new CacheEntry<>(s, r.getIssues()));
            summarizedThisRun.add(id);
            outcomes.put(id, new ProcedureOutcome(id, r.getStatus(), r.getIssues(), false, null));
            scheduler.onSummaryUpdated(id, changed, r.needsAnotherIteration());
            return;
        }

        SummaryStatus status = c.getStatus();
        if (status == SummaryStatus.FAILED_MALFORMED && config.isStrict()) {
            throw new AssertionError("Malformed instruction in " + id + ": " + c.getMessage());
        }
        if (status == SummaryStatus.CRASHED && item.getRetries() < config.getMaxRetries()) {
            if (outputLevel >= 1) {
                System.err.println("RETRYING " + item + " after crash: " + c.getMessage());
            }
            pool.submit(c.getRequest().retry());
            return;
        }
        if (outputLevel >= 1) {
            System.err.println("FAILED " + id + " " + status + ": " + c.getMessage());
        }
        FreshnessKey key = pendingKeys.remove(id);
        cache.invalidate(id);
        if (status != SummaryStatus.TIMED_OUT || config.substituteOnTimeout()) {
            S placeholder = domain.conservativeSummary(id, cg.getDescriptor(id).getFormals().size());
            Summary<S> s = Summary.create(id, key, status, placeholder, domain.codec());
            cache.putTransient(new CacheEntry<>(s, Collections.<Issue> emptyList()));
            summarizedThisRun.add(id);
        }
        else {
            summarizedThisRun.remove(id);
        }
        outcomes.put(id, new ProcedureOutcome(id, status, Collections.<Issue> emptyList(), false, c.getMessage()));
        scheduler.onFailure(id);
    }

    /**
     * Record procedures the scheduler skipped because their summaries were fresh
     */
    private void recordCacheHits() {
        for (ProcedureId id : scheduler.takeCacheHits()) {
            CacheEntry<S> e = cache.latest(id);
            assert e != null : "Cache hit without an entry for " + id;
            outcomes.put(id, new ProcedureOutcome(id, e.getSummary().getStatus(), e.getIssues(), true, null));
        }
    }

    /**
     * Mark members of SCCs stopped by the iteration cap
     */
    private void recordForced() {
        for (ProcedureId id : scheduler.takeForced()) {
            CacheEntry<S> e = cache.latest(id);
            if (e == null || e.getSummary().getStatus().isFailure()) {
                continue;
            }
            if (e.getSummary().getStatus() != SummaryStatus.CONVERGENCE_FORCED) {
                Summary<S> old = e.getSummary();
                Summary<S> s = Summary.create(id, old.getKey(), SummaryStatus.CONVERGENCE_FORCED, old.getPayload(),
                                              domain.codec());
                cache.put(new CacheEntry<>(s, e.getIssues()));
            }
            ProcedureOutcome o = outcomes.get(id);
            if (o != null) {
                outcomes.put(id, o.withStatus(SummaryStatus.CONVERGENCE_FORCED));
            }
        }
    }
}
