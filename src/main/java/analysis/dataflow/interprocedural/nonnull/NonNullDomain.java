package analysis.dataflow.interprocedural.nonnull;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import analysis.dataflow.AbstractDomain;
import analysis.dataflow.Issue;
import analysis.dataflow.MalformedInstructionException;
import analysis.ir.AllocateInstruction;
import analysis.ir.AssignInstruction;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.InstructionVisitor;
import analysis.ir.LoadInstruction;
import analysis.ir.Location;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.PruneInstruction;
import analysis.ir.ReturnInstruction;
import analysis.ir.StoreInstruction;
import analysis.summary.SummaryCodec;

/**
 * Intra-procedural nullness of local variables, with summaries giving the nullness of the return value. The analysis
 * is optimistic: formals, field values and results of unknown procedures are assumed non-null, so a value may be
 * null only if the null constant can flow into it. A dereferenced variable is non-null afterwards.
 */
public class NonNullDomain implements AbstractDomain<NonNullState, NonNullAbsVal> {

    public static final String NULLABLE_DEREFERENCE = "NULLABLE_DEREFERENCE";

    private static final String RETURN = "$ret";

    private static final SummaryCodec<NonNullAbsVal> CODEC = new SummaryCodec<NonNullAbsVal>() {
        @Override
        public Object toJSON(NonNullAbsVal payload) {
            return payload.toString();
        }

        @Override
        public NonNullAbsVal fromJSON(Object json) {
            return NonNullAbsVal.fromString((String) json);
        }
    };

    @Override
    public NonNullState initialState(ProcedureDescriptor pd) {
        return NonNullState.empty();
    }

    @Override
    public NonNullState bottom() {
        return NonNullState.BOTTOM;
    }

    @Override
    public NonNullState transfer(final NonNullState d, Instruction i) {
        if (d.isBottom()) {
            return d;
        }
        return i.accept(new InstructionVisitor<NonNullState>() {

            @Override
            public NonNullState visitLoad(LoadInstruction i) {
                return d.setLocal(i.getBase(), NonNullAbsVal.NON_NULL).setLocal(i.getTarget(), NonNullAbsVal.NON_NULL);
            }

            @Override
            public NonNullState visitStore(StoreInstruction i) {
                return d.setLocal(i.getBase(), NonNullAbsVal.NON_NULL);
            }

            @Override
            public NonNullState visitAssign(AssignInstruction i) {
                return d.setLocal(i.getTarget(), eval(d, i.getValue()));
            }

            @Override
            public NonNullState visitAllocate(AllocateInstruction i) {
                return d.setLocal(i.getTarget(), NonNullAbsVal.NON_NULL);
            }

            @Override
            public NonNullState visitPrune(PruneInstruction i) {
                Operand lhs = i.getLhs();
                Operand rhs = i.getRhs();
                if (lhs == Operand.NULL && rhs == Operand.NULL) {
                    return i.getOp() == PruneInstruction.Comparison.EQ ? d : NonNullState.BOTTOM;
                }
                Operand var = rhs == Operand.NULL ? lhs : lhs == Operand.NULL ? rhs : null;
                if (var == null || !var.isVariable()) {
                    return d;
                }
                String name = ((Operand.Variable) var).getName();
                NonNullAbsVal v = i.getOp() == PruneInstruction.Comparison.EQ ? NonNullAbsVal.MAY_BE_NULL
                        : NonNullAbsVal.NON_NULL;
                return d.setLocal(name, v);
            }

            @Override
            public NonNullState visitCall(CallInstruction i) {
                throw new MalformedInstructionException(i, "calls are interpreted through summaries");
            }

            @Override
            public NonNullState visitReturn(ReturnInstruction i) {
                if (i.getValue() == null) {
                    return d;
                }
                return d.setLocal(RETURN, eval(d, i.getValue()));
            }
        });
    }

    private static NonNullAbsVal eval(NonNullState d, Operand o) {
        if (o == Operand.NULL) {
            return NonNullAbsVal.MAY_BE_NULL;
        }
        if (o.isVariable()) {
            return d.getLocal(((Operand.Variable) o).getName());
        }
        return NonNullAbsVal.NON_NULL;
    }

    @Override
    public NonNullState join(NonNullState d1, NonNullState d2) {
        return d1.join(d2);
    }

    @Override
    public NonNullState widen(NonNullState older, NonNullState newer, int iteration) {
        // finite height
        return older.join(newer);
    }

    @Override
    public boolean leq(NonNullState d1, NonNullState d2) {
        return d1.leq(d2);
    }

    @Override
    public NonNullState applySummary(NonNullState caller, NonNullAbsVal calleeSummary, CallInstruction call) {
        if (caller.isBottom() || call.getTarget() == null) {
            return caller;
        }
        return caller.setLocal(call.getTarget(), calleeSummary);
    }

    @Override
    public NonNullAbsVal extractSummary(ProcedureDescriptor pd, Set<NonNullState> exitStates) {
        NonNullAbsVal ret = NonNullAbsVal.NON_NULL;
        for (NonNullState d : exitStates) {
            if (!d.isBottom()) {
                ret = ret.join(d.getLocal(RETURN));
            }
        }
        return ret;
    }

    @Override
    public List<Issue> report(NonNullState d, Instruction i, Location loc) {
        if (d.isBottom()) {
            return Collections.emptyList();
        }
        String base;
        if (i instanceof LoadInstruction) {
            base = ((LoadInstruction) i).getBase();
        }
        else if (i instanceof StoreInstruction) {
            base = ((StoreInstruction) i).getBase();
        }
        else {
            return Collections.emptyList();
        }
        if (d.getLocal(base).isNonnull()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new Issue(loc, NULLABLE_DEREFERENCE, "dereference of " + base
                + " which may be null", Collections.<String> emptyList()));
    }

    /**
     * Summaries only describe the return value, so nothing is required of the arguments
     */
    @Override
    public List<Issue> reportCall(NonNullState d, ProcedureId callee, NonNullAbsVal calleeSummary,
                                  CallInstruction call, Location loc) {
        return Collections.emptyList();
    }

    @Override
    public NonNullAbsVal conservativeSummary(ProcedureId id, int arity) {
        return NonNullAbsVal.NON_NULL;
    }

    @Override
    public NonNullAbsVal widenSummary(NonNullAbsVal previous, NonNullAbsVal current) {
        return previous.join(current);
    }

    @Override
    public SummaryCodec<NonNullAbsVal> codec() {
        return CODEC;
    }

    @Override
    public String toString() {
        return "NonNullDomain";
    }
}
