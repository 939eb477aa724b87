package analysis.dataflow.interprocedural;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import analysis.dataflow.Issue;
import analysis.ir.ProcedureId;
import analysis.summary.CacheStatistics;
import analysis.summary.SummaryStatus;

/**
 * Outcome of an analysis run: status of every procedure, all issues, and counters
 */
public final class RunReport {

    private final Map<ProcedureId, ProcedureOutcome> outcomes;
    private final CacheStatistics cacheStatistics;
    private final int workItems;
    private final long elapsedMillis;

    RunReport(Map<ProcedureId, ProcedureOutcome> outcomes, CacheStatistics cacheStatistics, int workItems,
              long elapsedMillis) {
        this.outcomes = Collections.unmodifiableMap(new TreeMap<>(outcomes));
        this.cacheStatistics = cacheStatistics;
        this.workItems = workItems;
        this.elapsedMillis = elapsedMillis;
    }

    public Map<ProcedureId, ProcedureOutcome> getOutcomes() {
        return outcomes;
    }

    public ProcedureOutcome getOutcome(ProcedureId id) {
        return outcomes.get(id);
    }

    /**
     * All issues, grouped by procedure in procedure order
     *
     * @return issues
     */
    public List<Issue> getIssues() {
        List<Issue> all = new ArrayList<>();
        for (ProcedureOutcome o : outcomes.values()) {
            all.addAll(o.getIssues());
        }
        return all;
    }

    public int getNumProcedures() {
        return outcomes.size();
    }

    /**
     * Procedures analyzed in this run (not taken from the cache) that got a summary
     */
    public int getNumAnalyzed() {
        int n = 0;
        for (ProcedureOutcome o : outcomes.values()) {
            if (!o.isFromCache() && !o.getStatus().isFailure()) {
                n++;
            }
        }
        return n;
    }

    public int getNumCacheHits() {
        int n = 0;
        for (ProcedureOutcome o : outcomes.values()) {
            if (o.isFromCache()) {
                n++;
            }
        }
        return n;
    }

    public int count(SummaryStatus status) {
        int n = 0;
        for (ProcedureOutcome o : outcomes.values()) {
            if (o.getStatus() == status) {
                n++;
            }
        }
        return n;
    }

    public int getNumFailed() {
        int n = 0;
        for (ProcedureOutcome o : outcomes.values()) {
            if (o.getStatus().isFailure()) {
                n++;
            }
        }
        return n;
    }

    public CacheStatistics getCacheStatistics() {
        return cacheStatistics;
    }

    public int getWorkItems() {
        return workItems;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * Process exit status for the run
     *
     * @return 0 if every procedure got a real summary, 1 if some analyses failed
     */
    public int exitStatus() {
        return getNumFailed() == 0 ? 0 : 1;
    }

    @Override
    public String toString() {
        return "Procedures: " + getNumProcedures() + " analyzed: " + getNumAnalyzed() + " cached: "
                + getNumCacheHits() + " convergence forced: " + count(SummaryStatus.CONVERGENCE_FORCED)
                + " malformed: " + count(SummaryStatus.FAILED_MALFORMED) + " timed out: "
                + count(SummaryStatus.TIMED_OUT) + " crashed: " + count(SummaryStatus.CRASHED) + " issues: "
                + getIssues().size() + " work items: " + workItems + " time: " + elapsedMillis / 1000.0 + "s";
    }
}
