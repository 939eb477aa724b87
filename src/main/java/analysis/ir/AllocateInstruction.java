package analysis.ir;

/**
 * <code>target = new typeName</code>
 */
public final class AllocateInstruction extends Instruction {

    private final String target;
    private final String typeName;

    public AllocateInstruction(String target, String typeName, int line) {
        super(line);
        this.target = target;
        this.typeName = typeName;
    }

    public AllocateInstruction(String target, String typeName) {
        this(target, typeName, NO_LINE);
    }

    public String getTarget() {
        return target;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitAllocate(this);
    }

    @Override
    public String kindName() {
        return "allocate";
    }

    @Override
    public String toString() {
        return target + " = new " + typeName;
    }
}
