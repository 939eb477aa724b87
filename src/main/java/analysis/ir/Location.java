package analysis.ir;

/**
 * Position of an instruction: procedure, CFG node, index of the instruction in the node, and source line if known
 */
public final class Location {

    private final ProcedureId procedure;
    private final int node;
    private final int index;
    private final int line;

    public Location(ProcedureId procedure, int node, int index, int line) {
        this.procedure = procedure;
        this.node = node;
        this.index = index;
        this.line = line;
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public int getNode() {
        return node;
    }

    public int getIndex() {
        return index;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Location)) {
            return false;
        }
        Location other = (Location) obj;
        return procedure.equals(other.procedure) && node == other.node && index == other.index && line == other.line;
    }

    @Override
    public int hashCode() {
        return ((procedure.hashCode() * 31 + node) * 31 + index) * 31 + line;
    }

    @Override
    public String toString() {
        String s = procedure + "@N" + node + ":" + index;
        return line == Instruction.NO_LINE ? s : s + " (line " + line + ")";
    }
}
