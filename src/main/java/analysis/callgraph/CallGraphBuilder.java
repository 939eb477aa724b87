package analysis.callgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import analysis.ir.CFGNode;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;

import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.SCCIterator;

/**
 * Builds a {@link CallGraph} from procedure descriptors. Every candidate of a (possibly dynamically dispatched) call
 * becomes an edge. Components are found with WALA's {@link SCCIterator} and ordered bottom-up.
 */
public class CallGraphBuilder {

    /**
     * Logging level
     */
    private int outputLevel = 0;

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * Build the call graph for the given procedures (source and model descriptors alike)
     *
     * @param procedures
     *            descriptors, identifiers must be unique
     * @return call graph with bottom-up component order
     * @throws IllegalArgumentException
     *             if two descriptors have the same identifier
     */
    public CallGraph build(Collection<ProcedureDescriptor> procedures) {
        Map<ProcedureId, ProcedureDescriptor> descriptors = new TreeMap<>();
        for (ProcedureDescriptor d : procedures) {
            if (descriptors.put(d.getId(), d) != null) {
                throw new IllegalArgumentException("Duplicate procedure " + d.getId());
            }
        }

        SlowSparseNumberedGraph<ProcedureId> g = SlowSparseNumberedGraph.make();
        for (ProcedureId id : descriptors.keySet()) {
            g.addNode(id);
        }

        List<CallEdge> edges = new ArrayList<>();
        Map<ProcedureId, Set<ProcedureId>> external = new HashMap<>();
        Set<ProcedureId> selfRecursive = new TreeSet<>();
        for (ProcedureDescriptor d : descriptors.values()) {
            for (CFGNode n : d.getNodes()) {
                List<Instruction> instrs = n.getInstructions();
                for (int i = 0; i < instrs.size(); i++) {
                    if (!(instrs.get(i) instanceof CallInstruction)) {
                        continue;
                    }
                    CallInstruction call = (CallInstruction) instrs.get(i);
                    edges.add(new CallEdge(d.getId(), n.getId(), i, call.getCandidates()));
                    for (ProcedureId callee : call.getCandidates()) {
                        if (descriptors.containsKey(callee)) {
                            g.addEdge(d.getId(), callee);
                            if (callee.equals(d.getId())) {
                                selfRecursive.add(callee);
                            }
                        } else {
                            Set<ProcedureId> ext = external.get(d.getId());
                            if (ext == null) {
                                ext = new TreeSet<>();
                                external.put(d.getId(), ext);
                            }
                            ext.add(callee);
                            if (outputLevel >= 2) {
                                System.err.println("EXTERNAL CALLEE " + callee + " from " + d.getId());
                            }
                        }
                    }
                }
            }
        }

        List<TreeSet<ProcedureId>> components = new ArrayList<>();
        SCCIterator<ProcedureId> iter = new SCCIterator<>(g);
        while (iter.hasNext()) {
            components.add(new TreeSet<>(iter.next()));
        }

        List<Scc> ordered = bottomUp(components, g, selfRecursive);
        if (outputLevel >= 1) {
            System.err.println("CALL GRAPH: " + descriptors.size() + " procedures, " + edges.size() + " call sites, "
                    + ordered.size() + " SCCs");
        }
        return new CallGraph(descriptors, g, edges, external, ordered);
    }

    /**
     * Order components so that callees come before callers (Kahn's algorithm over the condensation). Ties are broken
     * by the smallest member so the order does not depend on the iteration order of the SCC computation.
     */
    private static List<Scc> bottomUp(List<TreeSet<ProcedureId>> components, SlowSparseNumberedGraph<ProcedureId> g,
                                      Set<ProcedureId> selfRecursive) {
        Map<ProcedureId, Integer> componentOf = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (ProcedureId m : components.get(i)) {
                componentOf.put(m, i);
            }
        }

        // pending[c] = number of distinct callee components of c not yet placed
        int[] pending = new int[components.size()];
        Map<Integer, Set<Integer>> callerComponents = new LinkedHashMap<>();
        for (int c = 0; c < components.size(); c++) {
            Set<Integer> callees = new TreeSet<>();
            for (ProcedureId m : components.get(c)) {
                Iterator<ProcedureId> succs = g.getSuccNodes(m);
                while (succs.hasNext()) {
                    int other = componentOf.get(succs.next());
                    if (other != c) {
                        callees.add(other);
                    }
                }
            }
            pending[c] = callees.size();
            for (Integer callee : callees) {
                Set<Integer> callers = callerComponents.get(callee);
                if (callers == null) {
                    callers = new TreeSet<>();
                    callerComponents.put(callee, callers);
                }
                callers.add(c);
            }
        }

        final List<TreeSet<ProcedureId>> comps = components;
        PriorityQueue<Integer> ready = new PriorityQueue<>(Math.max(1, components.size()), new Comparator<Integer>() {
            @Override
            public int compare(Integer a, Integer b) {
                return comps.get(a).first().compareTo(comps.get(b).first());
            }
        });
        for (int c = 0; c < components.size(); c++) {
            if (pending[c] == 0) {
                ready.add(c);
            }
        }

        List<Scc> ordered = new ArrayList<>(components.size());
        while (!ready.isEmpty()) {
            int c = ready.poll();
            TreeSet<ProcedureId> members = components.get(c);
            boolean recursive = members.size() > 1 || selfRecursive.contains(members.first());
            ordered.add(new Scc(ordered.size(), members, recursive));
            Set<Integer> callers = callerComponents.get(c);
            if (callers != null) {
                for (Integer caller : callers) {
                    pending[caller]--;
                    if (pending[caller] == 0) {
                        ready.add(caller);
                    }
                }
            }
        }
        assert ordered.size() == components.size() : "condensation of the call graph has a cycle";
        return ordered;
    }
}
