package analysis.ir;

/**
 * Set the return value of the procedure. Control still flows to the exit node through the CFG.
 */
public final class ReturnInstruction extends Instruction {

    /**
     * Returned value, null for a void return
     */
    private final Operand value;

    public ReturnInstruction(Operand value, int line) {
        super(line);
        this.value = value;
    }

    public ReturnInstruction(Operand value) {
        this(value, NO_LINE);
    }

    public Operand getValue() {
        return value;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitReturn(this);
    }

    @Override
    public String kindName() {
        return "return";
    }

    @Override
    public String toString() {
        return value == null ? "return" : "return " + value;
    }
}
