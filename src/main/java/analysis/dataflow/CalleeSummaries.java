package analysis.dataflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import analysis.ir.ProcedureId;

/**
 * Summaries available to the analysis of one procedure: the latest summary of each callee that has one, and the
 * members of the procedure's own SCC. A candidate callee with neither a summary nor membership in the SCC has no code
 * and gets the domain's conservative summary.
 *
 * @param <S>
 *            summary payload type
 */
public final class CalleeSummaries<S> {

    private final Map<ProcedureId, S> summaries;
    private final Set<ProcedureId> sccMembers;

    public CalleeSummaries(Map<ProcedureId, S> summaries, Set<ProcedureId> sccMembers) {
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        this.sccMembers = Collections.unmodifiableSet(new TreeSet<>(sccMembers));
    }

    /**
     * No callee summaries, procedure alone in its SCC
     */
    public static <S> CalleeSummaries<S> none(ProcedureId self) {
        return new CalleeSummaries<>(Collections.<ProcedureId, S> emptyMap(), Collections.singleton(self));
    }

    /**
     * @param callee
     *            candidate callee
     * @return summary to use for the callee, or null if there is none
     */
    public S get(ProcedureId callee) {
        return summaries.get(callee);
    }

    public boolean isSameScc(ProcedureId callee) {
        return sccMembers.contains(callee);
    }

    public Map<ProcedureId, S> getSummaries() {
        return summaries;
    }

    public Set<ProcedureId> getSccMembers() {
        return sccMembers;
    }
}
