package analysis.dataflow;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import analysis.ir.AssignInstruction;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.LoadInstruction;
import analysis.ir.Location;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.StoreInstruction;
import analysis.summary.SummaryCodec;

/**
 * Domain for exercising the solver: the fact is one counter, joined by max. An assignment of an integer constant adds
 * it to the counter, a call adds the callee's summary, a load is rejected as malformed and a store is reported.
 */
public class CounterDomain implements AbstractDomain<Long, Long> {

    public static final long TOP = Long.MAX_VALUE;
    public static final String STORE = "STORE";

    private static final SummaryCodec<Long> CODEC = new SummaryCodec<Long>() {
        @Override
        public Object toJSON(Long payload) {
            return payload;
        }

        @Override
        public Long fromJSON(Object json) {
            return ((Number) json).longValue();
        }
    };

    private final boolean widenToTop;

    /**
     * @param widenToTop
     *            whether widening jumps to {@link #TOP} or is only a join
     */
    public CounterDomain(boolean widenToTop) {
        this.widenToTop = widenToTop;
    }

    private static long add(long a, long b) {
        if (a == TOP || b == TOP) {
            return TOP;
        }
        return a + b;
    }

    @Override
    public Long initialState(ProcedureDescriptor pd) {
        return 0L;
    }

    @Override
    public Long bottom() {
        return Long.MIN_VALUE;
    }

    @Override
    public Long transfer(Long d, Instruction i) {
        if (d == Long.MIN_VALUE) {
            return d;
        }
        if (i instanceof LoadInstruction) {
            throw new MalformedInstructionException(i, "loads are not supported");
        }
        if (i instanceof AssignInstruction) {
            Operand v = ((AssignInstruction) i).getValue();
            if (v instanceof Operand.IntConstant) {
                return add(d, ((Operand.IntConstant) v).getValue());
            }
        }
        return d;
    }

    @Override
    public Long join(Long d1, Long d2) {
        return Math.max(d1, d2);
    }

    @Override
    public Long widen(Long older, Long newer, int iteration) {
        if (widenToTop && newer > older) {
            return TOP;
        }
        return join(older, newer);
    }

    @Override
    public boolean leq(Long d1, Long d2) {
        return d1 <= d2;
    }

    @Override
    public Long applySummary(Long caller, Long calleeSummary, CallInstruction call) {
        if (caller == Long.MIN_VALUE || calleeSummary == Long.MIN_VALUE) {
            return Long.MIN_VALUE;
        }
        return add(caller, calleeSummary);
    }

    @Override
    public Long extractSummary(ProcedureDescriptor pd, Set<Long> exitStates) {
        long s = Long.MIN_VALUE;
        for (Long d : exitStates) {
            s = Math.max(s, d);
        }
        return s;
    }

    @Override
    public List<Issue> report(Long d, Instruction i, Location loc) {
        if (i instanceof StoreInstruction && d != Long.MIN_VALUE) {
            return Collections.singletonList(new Issue(loc, STORE, "store with counter " + d,
                                                       Collections.<String> emptyList()));
        }
        return Collections.emptyList();
    }

    @Override
    public List<Issue> reportCall(Long d, ProcedureId callee, Long calleeSummary, CallInstruction call, Location loc) {
        return Collections.emptyList();
    }

    @Override
    public Long conservativeSummary(ProcedureId id, int arity) {
        return TOP;
    }

    @Override
    public Long widenSummary(Long previous, Long current) {
        return current > previous ? TOP : previous;
    }

    @Override
    public SummaryCodec<Long> codec() {
        return CODEC;
    }
}
