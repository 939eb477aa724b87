package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import util.Hashing;

/**
 * Intermediate representation of one procedure as produced by a frontend (or a model file): identifier, formal
 * parameters, and control flow graph. Immutable.
 */
public final class ProcedureDescriptor {

    private final ProcedureId id;
    private final List<String> formals;
    private final int entry;
    private final int exit;
    /**
     * Nodes sorted by id
     */
    private final Map<Integer, CFGNode> nodes;
    /**
     * Predecessor ids of each node, computed from the successor sets
     */
    private final Map<Integer, Set<Integer>> preds;
    /**
     * True if this descriptor came from a model file rather than from source
     */
    private final boolean isModel;
    /**
     * Memoized code hash
     */
    private String codeHash;

    private ProcedureDescriptor(ProcedureId id, List<String> formals, int entry, int exit, Map<Integer, CFGNode> nodes,
                                boolean isModel) {
        this.id = id;
        this.formals = Collections.unmodifiableList(new ArrayList<>(formals));
        this.entry = entry;
        this.exit = exit;
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        this.isModel = isModel;

        Map<Integer, Set<Integer>> p = new LinkedHashMap<>();
        for (Integer n : this.nodes.keySet()) {
            p.put(n, new LinkedHashSet<Integer>());
        }
        for (CFGNode n : this.nodes.values()) {
            for (Integer s : n.getSuccs()) {
                p.get(s).add(n.getId());
            }
        }
        this.preds = p;
    }

    public ProcedureId getId() {
        return id;
    }

    public List<String> getFormals() {
        return formals;
    }

    public int getEntry() {
        return entry;
    }

    public int getExit() {
        return exit;
    }

    public boolean isModel() {
        return isModel;
    }

    public CFGNode getNode(int nodeId) {
        CFGNode n = nodes.get(nodeId);
        assert n != null : "No node N" + nodeId + " in " + id;
        return n;
    }

    public Iterable<CFGNode> getNodes() {
        return nodes.values();
    }

    public int getNumNodes() {
        return nodes.size();
    }

    /**
     * Predecessors of the given node in the control flow graph
     *
     * @param nodeId
     *            node to get the predecessors of
     * @return ids of nodes with an edge to <code>nodeId</code>
     */
    public Set<Integer> getPreds(int nodeId) {
        Set<Integer> p = preds.get(nodeId);
        return p == null ? Collections.<Integer> emptySet() : Collections.unmodifiableSet(p);
    }

    /**
     * All call instructions in this procedure together with the node they are in
     *
     * @return map from node id to the call instructions in that node (in order)
     */
    public Map<Integer, List<CallInstruction>> getCalls() {
        Map<Integer, List<CallInstruction>> calls = new LinkedHashMap<>();
        for (CFGNode n : nodes.values()) {
            for (Instruction i : n.getInstructions()) {
                if (i instanceof CallInstruction) {
                    List<CallInstruction> l = calls.get(n.getId());
                    if (l == null) {
                        l = new ArrayList<>();
                        calls.put(n.getId(), l);
                    }
                    l.add((CallInstruction) i);
                }
            }
        }
        return calls;
    }

    /**
     * Hash of everything that can influence the analysis of this procedure's body: formals, entry, exit, nodes,
     * instructions (including source lines) and edges.
     *
     * @return hex digest
     */
    public String codeHash() {
        if (codeHash == null) {
            StringBuilder sb = new StringBuilder();
            sb.append(id).append('|').append(formals).append('|').append(entry).append('|').append(exit);
            for (CFGNode n : nodes.values()) {
                sb.append("|N").append(n.getId()).append("->").append(n.getSuccs());
                for (Instruction i : n.getInstructions()) {
                    sb.append(';').append(i.kindName()).append('@').append(i.getLine()).append(':').append(i);
                }
            }
            codeHash = Hashing.sha256(sb.toString());
        }
        return codeHash;
    }

    @Override
    public String toString() {
        return id + "(" + formals + ")";
    }

    /**
     * Start building a descriptor
     *
     * @param id
     *            procedure identifier
     * @param formals
     *            formal parameter names in order
     * @return new builder
     */
    public static Builder builder(ProcedureId id, String... formals) {
        Builder b = new Builder(id);
        for (String f : formals) {
            b.addFormal(f);
        }
        return b;
    }

    /**
     * Mutable builder for {@link ProcedureDescriptor}s, used by frontends, the JSON reader and tests
     */
    public static final class Builder {
        private final ProcedureId id;
        private final List<String> formals = new ArrayList<>();
        private final Map<Integer, List<Instruction>> instructions = new LinkedHashMap<>();
        private final Map<Integer, Set<Integer>> succs = new LinkedHashMap<>();
        private Integer entry;
        private Integer exit;
        private boolean isModel;

        Builder(ProcedureId id) {
            this.id = id;
        }

        public Builder addFormal(String name) {
            formals.add(name);
            return this;
        }

        /**
         * Add a node (or more instructions to an existing node)
         *
         * @param nodeId
         *            node identifier
         * @param instrs
         *            instructions to append to the node
         * @return this builder
         */
        public Builder node(int nodeId, Instruction... instrs) {
            List<Instruction> l = instructions.get(nodeId);
            if (l == null) {
                l = new ArrayList<>();
                instructions.put(nodeId, l);
                succs.put(nodeId, new LinkedHashSet<Integer>());
            }
            Collections.addAll(l, instrs);
            return this;
        }

        public Builder edge(int from, int to) {
            node(from);
            node(to);
            succs.get(from).add(to);
            return this;
        }

        public Builder entry(int nodeId) {
            node(nodeId);
            this.entry = nodeId;
            return this;
        }

        public Builder exit(int nodeId) {
            node(nodeId);
            this.exit = nodeId;
            return this;
        }

        public Builder model(boolean model) {
            this.isModel = model;
            return this;
        }

        /**
         * Check the graph and create the descriptor
         *
         * @return immutable descriptor
         * @throws IllegalStateException
         *             if the entry or exit node is missing, or the exit node has successors
         */
        public ProcedureDescriptor build() {
            if (entry == null || exit == null) {
                throw new IllegalStateException("Procedure " + id + " needs an entry and an exit node");
            }
            if (!succs.get(exit).isEmpty()) {
                throw new IllegalStateException("Exit node N" + exit + " of " + id + " has successors "
                        + succs.get(exit));
            }
            Map<Integer, CFGNode> nodes = new LinkedHashMap<>();
            for (Map.Entry<Integer, List<Instruction>> e : instructions.entrySet()) {
                nodes.put(e.getKey(), new CFGNode(e.getKey(), e.getValue(), succs.get(e.getKey())));
            }
            return new ProcedureDescriptor(id, formals, entry, exit, nodes, isModel);
        }
    }
}
