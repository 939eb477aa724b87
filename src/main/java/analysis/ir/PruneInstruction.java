package analysis.ir;

/**
 * <code>assume(lhs op rhs)</code>. Conditional branches are lowered to a prune at the start of each successor, so
 * executions that violate the condition stop here.
 */
public final class PruneInstruction extends Instruction {

    /**
     * Comparison operator
     */
    public enum Comparison {
        EQ("=="), NE("!=");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public Comparison negate() {
            return this == EQ ? NE : EQ;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private final Operand lhs;
    private final Comparison op;
    private final Operand rhs;

    public PruneInstruction(Operand lhs, Comparison op, Operand rhs, int line) {
        super(line);
        this.lhs = lhs;
        this.op = op;
        this.rhs = rhs;
    }

    public PruneInstruction(Operand lhs, Comparison op, Operand rhs) {
        this(lhs, op, rhs, NO_LINE);
    }

    public Operand getLhs() {
        return lhs;
    }

    public Comparison getOp() {
        return op;
    }

    public Operand getRhs() {
        return rhs;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitPrune(this);
    }

    @Override
    public String kindName() {
        return "prune";
    }

    @Override
    public String toString() {
        return "assume(" + lhs + " " + op + " " + rhs + ")";
    }
}
