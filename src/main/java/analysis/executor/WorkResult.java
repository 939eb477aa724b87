package analysis.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.dataflow.Issue;
import analysis.summary.SummaryStatus;

/**
 * What a worker sends back for a request it finished, either a summary or a malformed-instruction failure
 *
 * @param <S>
 *            summary payload type
 */
public final class WorkResult<S> {

    private final SummaryStatus status;
    private final S payload;
    private final List<Issue> issues;
    private final boolean needsAnotherIteration;
    private final int nodeVisits;
    private final int instructions;
    private final String message;

    public WorkResult(SummaryStatus status, S payload, List<Issue> issues, boolean needsAnotherIteration,
                      int nodeVisits, int instructions, String message) {
        assert status == SummaryStatus.FAILED_MALFORMED || payload != null : "No summary for " + status;
        this.status = status;
        this.payload = payload;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.needsAnotherIteration = needsAnotherIteration;
        this.nodeVisits = nodeVisits;
        this.instructions = instructions;
        this.message = message;
    }

    public static <S> WorkResult<S> malformed(String message) {
        return new WorkResult<>(SummaryStatus.FAILED_MALFORMED, null, Collections.<Issue> emptyList(), false, 0, 0,
                                message);
    }

    public SummaryStatus getStatus() {
        return status;
    }

    /**
     * @return the summary, null if the analysis failed
     */
    public S getPayload() {
        return payload;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public boolean needsAnotherIteration() {
        return needsAnotherIteration;
    }

    public int getNodeVisits() {
        return nodeVisits;
    }

    public int getInstructions() {
        return instructions;
    }

    /**
     * @return failure description, null on success
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "WorkResult(" + status + (message == null ? "" : ": " + message) + ")";
    }
}
