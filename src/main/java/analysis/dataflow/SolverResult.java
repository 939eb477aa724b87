package analysis.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of running the {@link FixpointSolver} on one procedure
 *
 * @param <S>
 *            summary payload type
 */
public final class SolverResult<S> {

    private final S summary;
    private final List<Issue> issues;
    /**
     * A node hit the visit cap and was frozen before its input stabilized
     */
    private final boolean convergenceForced;
    /**
     * A call to a member of the same SCC had no summary yet and was treated as unreachable
     */
    private final boolean needsAnotherIteration;
    private final int nodeVisits;
    private final int instructions;

    SolverResult(S summary, List<Issue> issues, boolean convergenceForced, boolean needsAnotherIteration,
                 int nodeVisits, int instructions) {
        this.summary = summary;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.convergenceForced = convergenceForced;
        this.needsAnotherIteration = needsAnotherIteration;
        this.nodeVisits = nodeVisits;
        this.instructions = instructions;
    }

    public S getSummary() {
        return summary;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public boolean isConvergenceForced() {
        return convergenceForced;
    }

    public boolean needsAnotherIteration() {
        return needsAnotherIteration;
    }

    /**
     * Number of times a node was (re)interpreted
     */
    public int getNodeVisits() {
        return nodeVisits;
    }

    /**
     * Number of instructions interpreted, counting repeats
     */
    public int getInstructions() {
        return instructions;
    }

    @Override
    public String toString() {
        return "SolverResult(" + summary + ", " + issues.size() + " issues" + (convergenceForced ? ", forced" : "")
                + ")";
    }
}
