package analysis.callgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.ir.ProcedureId;

/**
 * Call site in a caller together with every procedure it may invoke
 */
public final class CallEdge {

    private final ProcedureId caller;
    private final int callSiteNode;
    /**
     * Index of the call instruction within the call-site node
     */
    private final int instructionIndex;
    private final List<ProcedureId> candidates;

    public CallEdge(ProcedureId caller, int callSiteNode, int instructionIndex, List<ProcedureId> candidates) {
        assert !candidates.isEmpty();
        this.caller = caller;
        this.callSiteNode = callSiteNode;
        this.instructionIndex = instructionIndex;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public ProcedureId getCaller() {
        return caller;
    }

    public int getCallSiteNode() {
        return callSiteNode;
    }

    public int getInstructionIndex() {
        return instructionIndex;
    }

    public List<ProcedureId> getCandidates() {
        return candidates;
    }

    public boolean isDynamicDispatch() {
        return candidates.size() > 1;
    }

    @Override
    public String toString() {
        return caller + "@N" + callSiteNode + ":" + instructionIndex + " -> " + candidates;
    }
}
