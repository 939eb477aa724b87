package analysis.ir;

/**
 * <code>base.field = value</code>, dereferences <code>base</code>
 */
public final class StoreInstruction extends Instruction {

    private final String base;
    private final String field;
    private final Operand value;

    public StoreInstruction(String base, String field, Operand value, int line) {
        super(line);
        this.base = base;
        this.field = field;
        this.value = value;
    }

    public StoreInstruction(String base, String field, Operand value) {
        this(base, field, value, NO_LINE);
    }

    public String getBase() {
        return base;
    }

    public String getField() {
        return field;
    }

    public Operand getValue() {
        return value;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitStore(this);
    }

    @Override
    public String kindName() {
        return "store";
    }

    @Override
    public String toString() {
        return base + "." + field + " = " + value;
    }
}
