package analysis.ir;

/**
 * <code>target = base.field</code>, dereferences <code>base</code>
 */
public final class LoadInstruction extends Instruction {

    private final String target;
    private final String base;
    private final String field;

    public LoadInstruction(String target, String base, String field, int line) {
        super(line);
        this.target = target;
        this.base = base;
        this.field = field;
    }

    public LoadInstruction(String target, String base, String field) {
        this(target, base, field, NO_LINE);
    }

    public String getTarget() {
        return target;
    }

    public String getBase() {
        return base;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitLoad(this);
    }

    @Override
    public String kindName() {
        return "load";
    }

    @Override
    public String toString() {
        return target + " = " + base + "." + field;
    }
}
