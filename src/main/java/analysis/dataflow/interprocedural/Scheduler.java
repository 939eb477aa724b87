package analysis.dataflow.interprocedural;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import util.WorkQueue;
import analysis.callgraph.CallGraph;
import analysis.callgraph.Scc;
import analysis.ir.ProcedureId;
import analysis.summary.SummaryCache;

/**
 * Decides which procedures to analyze next. SCCs of the call graph are processed bottom-up: an SCC becomes ready once
 * every SCC it calls into is complete. A non-recursive SCC needs a single work item. A recursive SCC keeps a work queue
 * of members to (re)analyze; whenever a member's summary changes, its callers in the SCC are put back on the queue, and
 * the SCC is complete when the queue is empty or the iteration cap is reached.
 * <p>
 * At most one work item is in flight per SCC, hence at most one per procedure.
 * <p>
 * Not thread safe, only the coordinator uses it.
 */
public final class Scheduler {

    private final CallGraph cg;
    /**
     * Consulted when an SCC becomes ready, may be null
     */
    private final SummaryCache<?> cache;
    private final int maxSccIterations;
    private final int summaryWideningThreshold;

    /**
     * Number of incomplete callee SCCs, indexed by SCC
     */
    private final int[] remainingDeps;
    private final boolean[] complete;
    /**
     * Indices of SCCs that are ready and not complete, in bottom-up order
     */
    private final TreeSet<Integer> ready = new TreeSet<>();
    /**
     * Members of a ready SCC still to be analyzed
     */
    private final Map<Integer, WorkQueue<ProcedureId>> sccQueues = new HashMap<>();
    /**
     * Number of work items issued for each SCC
     */
    private final int[] itemsIssued;
    /**
     * Number of work items issued for each procedure
     */
    private final Map<ProcedureId, Integer> analyses = new HashMap<>();
    private final Map<ProcedureId, WorkItem> inFlight = new HashMap<>();
    private final Set<Integer> sccsInFlight = new LinkedHashSet<>();
    private final Set<ProcedureId> failed = new LinkedHashSet<>();
    /**
     * Procedures whose cached summary was fresh when their SCC became ready
     */
    private final Set<ProcedureId> freshAtRelease = new LinkedHashSet<>();

    private final List<ProcedureId> cacheHits = new ArrayList<>();
    private final List<ProcedureId> forced = new ArrayList<>();
    private int numComplete = 0;
    private int totalItems = 0;
    private int outputLevel = 0;

    /**
     * Create a scheduler; SCCs without callees are ready immediately
     *
     * @param cg
     *            call graph
     * @param cache
     *            summary cache used to skip SCCs whose summaries are all fresh, null to analyze everything
     * @param maxSccIterations
     *            average number of analyses per member of a recursive SCC before it is declared converged
     * @param summaryWideningThreshold
     *            analyses of a member of a recursive SCC after which its summary is widened
     */
    public Scheduler(CallGraph cg, SummaryCache<?> cache, int maxSccIterations, int summaryWideningThreshold) {
        this.cg = cg;
        this.cache = cache;
        this.maxSccIterations = maxSccIterations;
        this.summaryWideningThreshold = summaryWideningThreshold;
        int n = cg.getSccs().size();
        this.remainingDeps = new int[n];
        this.complete = new boolean[n];
        this.itemsIssued = new int[n];
        List<Scc> leaves = new ArrayList<>();
        for (Scc scc : cg.getSccs()) {
            remainingDeps[scc.getIndex()] = cg.getCalleeSccs(scc).size();
            if (remainingDeps[scc.getIndex()] == 0) {
                leaves.add(scc);
            }
        }
        for (Scc scc : leaves) {
            release(scc);
        }
    }

    public Scheduler(CallGraph cg, SummaryCache<?> cache, EngineConfig config) {
        this(cg, cache, config.getMaxSccIterations(), config.getSummaryWideningThreshold());
        this.outputLevel = config.getOutputLevel();
    }

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * Work items that can be analyzed now. Each returned item is in flight until {@link #onSummaryUpdated} or
     * {@link #onFailure} is called for its procedure.
     *
     * @return new work items in bottom-up order, empty if nothing is ready right now
     */
    public List<WorkItem> readyWork() {
        List<WorkItem> items = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Integer idx : new ArrayList<>(ready)) {
                if (sccsInFlight.contains(idx) || complete[idx]) {
                    continue;
                }
                Scc scc = cg.getSccs().get(idx);
                WorkQueue<ProcedureId> q = sccQueues.get(idx);
                ProcedureId next = null;
                while (next == null && !q.isEmpty()) {
                    ProcedureId p = q.poll();
                    if (!failed.contains(p)) {
                        next = p;
                    }
                }
                if (next == null) {
                    completeScc(scc);
                    changed = true;
                    continue;
                }
                Integer count = analyses.get(next);
                count = count == null ? 0 : count;
                analyses.put(next, count + 1);
                boolean widen = scc.isRecursive() && count >= summaryWideningThreshold;
                WorkItem item = new WorkItem(next, idx, 0, widen);
                inFlight.put(next, item);
                sccsInFlight.add(idx);
                itemsIssued[idx]++;
                totalItems++;
                items.add(item);
            }
        }
        if (outputLevel >= 2 && !items.isEmpty()) {
            System.err.println("READY: " + items);
        }
        return items;
    }

    /**
     * Record that the in-flight item for <code>id</code> produced a summary
     *
     * @param id
     *            procedure
     * @param changed
     *            true if the new summary differs from the previous one (or there was none)
     */
    public void onSummaryUpdated(ProcedureId id, boolean changed) {
        onSummaryUpdated(id, changed, false);
    }

    /**
     * Record that the in-flight item for <code>id</code> produced a summary
     *
     * @param id
     *            procedure
     * @param changed
     *            true if the new summary differs from the previous one (or there was none)
     * @param incomplete
     *            true if the analysis met a call to a member of the SCC that had no summary yet, in which case the
     *            procedure itself is analyzed again
     */
    public void onSummaryUpdated(ProcedureId id, boolean changed, boolean incomplete) {
        Scc scc = finishItem(id);
        if (scc.isRecursive() && changed) {
            requeueCallers(scc, id);
        }
        if (scc.isRecursive() && incomplete && !failed.contains(id)) {
            sccQueues.get(scc.getIndex()).add(id);
        }
        afterItem(scc);
    }

    /**
     * Record that the analysis of <code>id</code> failed and a placeholder summary was stored. The procedure is not
     * analyzed again in this run.
     *
     * @param id
     *            procedure
     */
    public void onFailure(ProcedureId id) {
        Scc scc = finishItem(id);
        failed.add(id);
        if (scc.isRecursive()) {
            requeueCallers(scc, id);
        }
        afterItem(scc);
    }

    /**
     * True if the analysis of the procedure failed in this run
     */
    public boolean hasFailed(ProcedureId id) {
        return failed.contains(id);
    }

    public boolean isFinished() {
        return numComplete == complete.length;
    }

    /**
     * True if the procedure had a fresh cached summary when its SCC became ready. Such a summary can be used by
     * callers in the same SCC before the procedure is analyzed again.
     *
     * @param id
     *            procedure
     * @return whether the cached summary was fresh
     */
    public boolean wasFreshAtRelease(ProcedureId id) {
        return freshAtRelease.contains(id);
    }

    public boolean hasInFlight() {
        return !inFlight.isEmpty();
    }

    public int getNumInFlight() {
        return inFlight.size();
    }

    /**
     * Total number of work items handed out, for statistics
     *
     * @return number of items
     */
    public int getTotalItems() {
        return totalItems;
    }

    /**
     * Procedures whose SCC was completed without analysis since the last call, because every member had a fresh
     * summary
     *
     * @return procedures, in bottom-up order
     */
    public List<ProcedureId> takeCacheHits() {
        List<ProcedureId> l = new ArrayList<>(cacheHits);
        cacheHits.clear();
        return l;
    }

    /**
     * Members of recursive SCCs that were declared converged by the iteration cap since the last call
     *
     * @return procedures
     */
    public List<ProcedureId> takeForced() {
        List<ProcedureId> l = new ArrayList<>(forced);
        forced.clear();
        return l;
    }

    private Scc finishItem(ProcedureId id) {
        WorkItem item = inFlight.remove(id);
        assert item != null : "No work item in flight for " + id;
        sccsInFlight.remove(item.getSccIndex());
        return cg.getSccs().get(item.getSccIndex());
    }

    private void requeueCallers(Scc scc, ProcedureId id) {
        WorkQueue<ProcedureId> q = sccQueues.get(scc.getIndex());
        for (ProcedureId caller : cg.getCallers(id)) {
            if (scc.getMembers().contains(caller) && !failed.contains(caller)) {
                q.add(caller);
            }
        }
    }

    private void afterItem(Scc scc) {
        WorkQueue<ProcedureId> q = sccQueues.get(scc.getIndex());
        if (q.isEmpty()) {
            completeScc(scc);
        }
        else if (itemsIssued[scc.getIndex()] >= maxSccIterations * scc.size()) {
            if (outputLevel >= 1) {
                System.err.println("SCC" + scc.getIndex() + " " + scc.getMembers() + " did not converge after "
                        + itemsIssued[scc.getIndex()] + " analyses, still pending " + q);
            }
            for (ProcedureId m : scc.getMembers()) {
                if (!failed.contains(m)) {
                    forced.add(m);
                }
            }
            completeScc(scc);
        }
    }

    /**
     * All callees of the SCC are complete: check the cache and either complete it right away or queue its members
     */
    private void release(Scc first) {
        WorkQueue<Scc> toRelease = new WorkQueue<>();
        toRelease.add(first);
        while (!toRelease.isEmpty()) {
            Scc scc = toRelease.poll();
            WorkQueue<ProcedureId> q = new WorkQueue<>();
            for (ProcedureId m : scc.getMembers()) {
                if (cache == null || cache.get(m) == null) {
                    q.add(m);
                }
                else {
                    freshAtRelease.add(m);
                }
            }
            if (!q.isEmpty()) {
                sccQueues.put(scc.getIndex(), q);
                ready.add(scc.getIndex());
                continue;
            }
            if (outputLevel >= 2) {
                System.err.println("CACHED SCC" + scc.getIndex() + " " + scc.getMembers());
            }
            cacheHits.addAll(scc.getMembers());
            toRelease.addAll(markComplete(scc));
        }
    }

    private void completeScc(Scc scc) {
        for (Scc caller : markComplete(scc)) {
            release(caller);
        }
    }

    /**
     * Mark the SCC complete
     *
     * @return caller SCCs that have just become ready
     */
    private List<Scc> markComplete(Scc scc) {
        int idx = scc.getIndex();
        assert !complete[idx] : "SCC" + idx + " completed twice";
        complete[idx] = true;
        numComplete++;
        ready.remove(idx);
        sccQueues.remove(idx);
        List<Scc> released = new ArrayList<>();
        for (Scc caller : cg.getCallerSccs(scc)) {
            remainingDeps[caller.getIndex()]--;
            if (remainingDeps[caller.getIndex()] == 0) {
                released.add(caller);
            }
        }
        if (outputLevel >= 2) {
            System.err.println("COMPLETE SCC" + idx + " " + scc.getMembers() + " (" + numComplete + "/"
                    + complete.length + ")");
        }
        return released;
    }
}
