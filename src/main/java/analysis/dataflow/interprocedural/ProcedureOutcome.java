package analysis.dataflow.interprocedural;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.dataflow.Issue;
import analysis.ir.ProcedureId;
import analysis.summary.SummaryStatus;

/**
 * Final result for one procedure in a run
 */
public final class ProcedureOutcome {

    private final ProcedureId procedure;
    private final SummaryStatus status;
    private final List<Issue> issues;
    /**
     * True if the summary came from the cache without analysis
     */
    private final boolean fromCache;
    /**
     * Failure description, null on success
     */
    private final String message;

    public ProcedureOutcome(ProcedureId procedure, SummaryStatus status, List<Issue> issues, boolean fromCache,
                            String message) {
        this.procedure = procedure;
        this.status = status;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.fromCache = fromCache;
        this.message = message;
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public SummaryStatus getStatus() {
        return status;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public String getMessage() {
        return message;
    }

    ProcedureOutcome withStatus(SummaryStatus newStatus) {
        return new ProcedureOutcome(procedure, newStatus, issues, fromCache, message);
    }

    @Override
    public String toString() {
        return procedure + ": " + status + (fromCache ? " (cached)" : "") + (message == null ? "" : " " + message);
    }
}
