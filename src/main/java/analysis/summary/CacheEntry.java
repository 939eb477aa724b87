package analysis.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.dataflow.Issue;
import analysis.ir.ProcedureId;

/**
 * A summary together with the issues reported while computing it, so that a cache hit reproduces the issues as well
 *
 * @param <S>
 *            summary payload type
 */
public final class CacheEntry<S> {

    private final Summary<S> summary;
    private final List<Issue> issues;

    public CacheEntry(Summary<S> summary, List<Issue> issues) {
        this.summary = summary;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public ProcedureId getProcedure() {
        return summary.getProcedure();
    }

    public Summary<S> getSummary() {
        return summary;
    }

    public FreshnessKey getKey() {
        return summary.getKey();
    }

    public List<Issue> getIssues() {
        return issues;
    }

    @Override
    public String toString() {
        return summary + " issues=" + issues.size();
    }
}
