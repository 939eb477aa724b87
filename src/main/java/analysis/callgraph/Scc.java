package analysis.callgraph;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import analysis.ir.ProcedureId;

/**
 * Strongly connected component of the call graph, the unit of recursion handling
 */
public final class Scc {

    /**
     * Position in the bottom-up order computed by the {@link CallGraph}
     */
    private final int index;
    private final Set<ProcedureId> members;
    /**
     * True if some member calls a member (possibly itself)
     */
    private final boolean isRecursive;

    Scc(int index, Set<ProcedureId> members, boolean isRecursive) {
        this.index = index;
        this.members = Collections.unmodifiableSet(new TreeSet<>(members));
        this.isRecursive = isRecursive;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Members sorted by identifier
     *
     * @return procedures in this SCC
     */
    public Set<ProcedureId> getMembers() {
        return members;
    }

    public boolean isRecursive() {
        return isRecursive;
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "SCC" + index + (isRecursive ? "*" : "") + members;
    }
}
