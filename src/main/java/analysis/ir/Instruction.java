package analysis.ir;

/**
 * Instruction in a {@link CFGNode}. The set of subclasses is closed; analyses dispatch on them with an
 * {@link InstructionVisitor}.
 */
public abstract class Instruction {

    /**
     * Marker for instructions without a source line
     */
    public static final int NO_LINE = -1;

    /**
     * Source line, or {@link #NO_LINE}
     */
    private final int line;

    Instruction(int line) {
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    /**
     * Double dispatch on the instruction kind
     *
     * @param v
     *            visitor
     * @return the result of the visitor's method for this kind
     */
    public abstract <R> R accept(InstructionVisitor<R> v);

    /**
     * Short name of the instruction kind as used in the serialized form (e.g. "load")
     *
     * @return kind name
     */
    public abstract String kindName();
}
