package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Node in a procedure's control flow graph: a straight-line sequence of instructions and the ids of the nodes control
 * may flow to afterwards.
 */
public final class CFGNode {

    private final int id;
    private final List<Instruction> instructions;
    private final Set<Integer> succs;

    /**
     * Create a new CFG node
     *
     * @param id
     *            identifier, unique within the procedure
     * @param instructions
     *            instructions in execution order
     * @param succs
     *            ids of the successor nodes
     */
    public CFGNode(int id, List<Instruction> instructions, Set<Integer> succs) {
        this.id = id;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.succs = Collections.unmodifiableSet(new LinkedHashSet<>(succs));
    }

    public int getId() {
        return id;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Set<Integer> getSuccs() {
        return succs;
    }

    @Override
    public String toString() {
        return "N" + id + instructions + " -> " + succs;
    }
}
