package analysis.ir;

/**
 * <code>target = value</code> between locals and constants, touches no memory
 */
public final class AssignInstruction extends Instruction {

    private final String target;
    private final Operand value;

    public AssignInstruction(String target, Operand value, int line) {
        super(line);
        this.target = target;
        this.value = value;
    }

    public AssignInstruction(String target, Operand value) {
        this(target, value, NO_LINE);
    }

    public String getTarget() {
        return target;
    }

    public Operand getValue() {
        return value;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitAssign(this);
    }

    @Override
    public String kindName() {
        return "assign";
    }

    @Override
    public String toString() {
        return target + " = " + value;
    }
}
