package analysis.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>target = callee(args)</code>. Dynamically dispatched calls list every statically possible callee, the
 * analysis considers all of them.
 */
public final class CallInstruction extends Instruction {

    /**
     * Variable receiving the return value, null if the result is discarded
     */
    private final String target;
    private final List<ProcedureId> candidates;
    private final List<Operand> args;

    public CallInstruction(String target, List<ProcedureId> candidates, List<Operand> args, int line) {
        super(line);
        assert candidates != null && !candidates.isEmpty() : "call without any candidate callee";
        this.target = target;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public CallInstruction(String target, ProcedureId callee, List<Operand> args) {
        this(target, Collections.singletonList(callee), args, NO_LINE);
    }

    public String getTarget() {
        return target;
    }

    public List<ProcedureId> getCandidates() {
        return candidates;
    }

    public List<Operand> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitCall(this);
    }

    @Override
    public String kindName() {
        return "call";
    }

    @Override
    public String toString() {
        String callee = candidates.size() == 1 ? candidates.get(0).toString() : candidates.toString();
        return (target == null ? "" : target + " = ") + callee + args;
    }
}
