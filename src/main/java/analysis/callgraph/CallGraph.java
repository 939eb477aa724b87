package analysis.callgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;

import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;

/**
 * Call graph over all procedure descriptors of an analysis run, condensed into strongly connected components. Edges go
 * from caller to callee. Procedures are numbered nodes of a WALA graph so that components and caller sets can be
 * indexed by integer.
 */
public final class CallGraph {

    private final Map<ProcedureId, ProcedureDescriptor> descriptors;
    private final SlowSparseNumberedGraph<ProcedureId> graph;
    private final List<CallEdge> edges;
    /**
     * Callees named at a call site that have no descriptor, per caller
     */
    private final Map<ProcedureId, Set<ProcedureId>> externalCallees;
    /**
     * Components in bottom-up order: every callee component precedes its callers
     */
    private final List<Scc> sccs;
    /**
     * Component index for each graph node number
     */
    private final int[] sccOf;

    CallGraph(Map<ProcedureId, ProcedureDescriptor> descriptors, SlowSparseNumberedGraph<ProcedureId> graph,
              List<CallEdge> edges, Map<ProcedureId, Set<ProcedureId>> externalCallees, List<Scc> sccs) {
        this.descriptors = descriptors;
        this.graph = graph;
        this.edges = Collections.unmodifiableList(edges);
        this.externalCallees = externalCallees;
        this.sccs = Collections.unmodifiableList(sccs);
        this.sccOf = new int[graph.getMaxNumber() + 1];
        for (Scc scc : sccs) {
            for (ProcedureId m : scc.getMembers()) {
                sccOf[graph.getNumber(m)] = scc.getIndex();
            }
        }
    }

    public boolean contains(ProcedureId id) {
        return descriptors.containsKey(id);
    }

    /**
     * Descriptor of a procedure in the graph
     *
     * @param id
     *            procedure
     * @return descriptor, null if the procedure is external (no descriptor)
     */
    public ProcedureDescriptor getDescriptor(ProcedureId id) {
        return descriptors.get(id);
    }

    public Set<ProcedureId> getProcedures() {
        return Collections.unmodifiableSet(descriptors.keySet());
    }

    public int getNumProcedures() {
        return descriptors.size();
    }

    public List<CallEdge> getEdges() {
        return edges;
    }

    /**
     * Components in bottom-up order
     *
     * @return all components, callees before callers
     */
    public List<Scc> getSccs() {
        return sccs;
    }

    public Scc getScc(ProcedureId id) {
        assert contains(id) : "no procedure " + id;
        return sccs.get(sccOf[graph.getNumber(id)]);
    }

    public boolean inSameScc(ProcedureId a, ProcedureId b) {
        return contains(a) && contains(b) && sccOf[graph.getNumber(a)] == sccOf[graph.getNumber(b)];
    }

    /**
     * Direct callees that have descriptors, sorted
     *
     * @param id
     *            caller
     * @return callees
     */
    public Set<ProcedureId> getCallees(ProcedureId id) {
        return sorted(graph.getSuccNodes(id));
    }

    /**
     * Direct callers, sorted
     *
     * @param id
     *            callee
     * @return callers
     */
    public Set<ProcedureId> getCallers(ProcedureId id) {
        return sorted(graph.getPredNodes(id));
    }

    /**
     * Callees named by some call in <code>id</code> for which there is no descriptor
     *
     * @param id
     *            caller
     * @return external callees
     */
    public Set<ProcedureId> getExternalCallees(ProcedureId id) {
        Set<ProcedureId> s = externalCallees.get(id);
        return s == null ? Collections.<ProcedureId> emptySet() : Collections.unmodifiableSet(s);
    }

    /**
     * Components containing a callee of a member of the given component, not including the component itself
     *
     * @param scc
     *            component
     * @return callee components
     */
    public Set<Scc> getCalleeSccs(Scc scc) {
        Set<Scc> res = new LinkedHashSet<>();
        for (ProcedureId m : scc.getMembers()) {
            for (ProcedureId callee : getCallees(m)) {
                Scc other = getScc(callee);
                if (other != scc) {
                    res.add(other);
                }
            }
        }
        return res;
    }

    /**
     * Components containing a caller of a member of the given component, not including the component itself
     *
     * @param scc
     *            component
     * @return caller components
     */
    public Set<Scc> getCallerSccs(Scc scc) {
        Set<Scc> res = new LinkedHashSet<>();
        for (ProcedureId m : scc.getMembers()) {
            for (ProcedureId caller : getCallers(m)) {
                Scc other = getScc(caller);
                if (other != scc) {
                    res.add(other);
                }
            }
        }
        return res;
    }

    /**
     * The given procedures and everything that (transitively) calls them
     *
     * @param changed
     *            procedures
     * @return transitive callers including <code>changed</code>
     */
    public Set<ProcedureId> getTransitiveCallers(Set<ProcedureId> changed) {
        Set<ProcedureId> visited = new TreeSet<>();
        List<ProcedureId> stack = new ArrayList<>(changed);
        while (!stack.isEmpty()) {
            ProcedureId p = stack.remove(stack.size() - 1);
            if (contains(p) && visited.add(p)) {
                stack.addAll(getCallers(p));
            }
        }
        return visited;
    }

    private static Set<ProcedureId> sorted(Iterator<ProcedureId> iter) {
        Set<ProcedureId> s = new TreeSet<>();
        while (iter.hasNext()) {
            s.add(iter.next());
        }
        return s;
    }

    @Override
    public String toString() {
        return "CallGraph(" + descriptors.size() + " procedures, " + sccs.size() + " SCCs)";
    }
}
