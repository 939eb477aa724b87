package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

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
 * Separation-logic domain computing specs by bi-abduction. Each procedure is analyzed starting from an empty
 * footprint; accesses to cells the footprint does not yet describe add them to it, so that at the exit every disjunct
 * yields a spec: the footprint as precondition and the current heap as postcondition.
 * <p>
 * A field access through the null constant is reported as {@link #NULL_DEREFERENCE} and the path ends there, as is a
 * call passing null to a callee whose specs all dereference that argument. An instruction after which an object
 * allocated by the analyzed code is no longer reachable is reported as {@link #MEMORY_LEAK}.
 */
public class BiAbductionDomain implements AbstractDomain<HeapSet, BiAbductionSummary> {

    public static final String NULL_DEREFERENCE = "NULL_DEREFERENCE";
    public static final String MEMORY_LEAK = "MEMORY_LEAK";

    private final BiAbductionConfig config;

    public BiAbductionDomain() {
        this(new BiAbductionConfig());
    }

    public BiAbductionDomain(BiAbductionConfig config) {
        this.config = config;
    }

    public BiAbductionConfig getConfig() {
        return config;
    }

    @Override
    public HeapSet initialState(ProcedureDescriptor pd) {
        return HeapSet.of(SymbolicHeap.initial(pd.getFormals()));
    }

    @Override
    public HeapSet bottom() {
        return HeapSet.EMPTY;
    }

    @Override
    public HeapSet transfer(HeapSet d, Instruction i) {
        List<SymbolicHeap> out = new ArrayList<>();
        for (SymbolicHeap h : d) {
            out.addAll(i.accept(new Transfer(h.edit())));
        }
        return HeapSet.of(out);
    }

    @Override
    public HeapSet join(HeapSet d1, HeapSet d2) {
        return d1.join(d2);
    }

    @Override
    public HeapSet widen(HeapSet older, HeapSet newer, int iteration) {
        return Abstraction.widen(older, newer, config);
    }

    @Override
    public boolean leq(HeapSet d1, HeapSet d2) {
        return d1.leq(d2);
    }

    @Override
    public HeapSet applySummary(HeapSet caller, BiAbductionSummary calleeSummary, CallInstruction call) {
        List<SymbolicHeap> out = new ArrayList<>();
        for (SymbolicHeap h : caller) {
            List<SymbolicHeap> post = SpecApplier.apply(h, calleeSummary, call);
            if (post.isEmpty() && !calleeSummary.getSpecs().isEmpty()) {
                // the callee returns on some inputs, but not on one we can describe
                post = SpecApplier.apply(h, BiAbductionSummary.conservative(calleeSummary.getArity()), call);
            }
            out.addAll(post);
        }
        return HeapSet.of(out);
    }

    @Override
    public BiAbductionSummary extractSummary(ProcedureDescriptor pd, Set<HeapSet> exitStates) {
        SortedSet<Spec> specs = new TreeSet<>();
        for (HeapSet d : exitStates) {
            for (SymbolicHeap h : d) {
                specs.add(Spec.fromExitState(h));
            }
        }
        return new BiAbductionSummary(pd.getFormals().size(), BiAbductionSummary.bound(specs, config.getMaxSpecs()));
    }

    @Override
    public List<Issue> report(HeapSet d, Instruction i, Location loc) {
        String base;
        String field;
        if (i instanceof LoadInstruction) {
            base = ((LoadInstruction) i).getBase();
            field = ((LoadInstruction) i).getField();
        }
        else if (i instanceof StoreInstruction) {
            base = ((StoreInstruction) i).getBase();
            field = ((StoreInstruction) i).getField();
        }
        else {
            return reportLeak(d, i, loc);
        }
        for (SymbolicHeap h : d) {
            if (h.edit().lookup(base).equals(Term.NULL)) {
                String msg = "dereference of " + base + "." + field + " where " + base + " is null";
                return Collections.singletonList(new Issue(loc, NULL_DEREFERENCE, msg,
                                                           Collections.singletonList(h.toString())));
            }
        }
        return reportLeak(d, i, loc);
    }

    private static List<Issue> reportLeak(HeapSet d, Instruction i, Location loc) {
        if (i instanceof CallInstruction) {
            return Collections.emptyList();
        }
        for (SymbolicHeap h : d) {
            Transfer t = new Transfer(h.edit());
            i.accept(t);
            if (!t.leaked.isEmpty()) {
                String msg = "object allocated here becomes unreachable: " + t.leaked;
                return Collections.singletonList(new Issue(loc, MEMORY_LEAK, msg,
                                                           Collections.singletonList(h.toString())));
            }
        }
        return Collections.emptyList();
    }

    @Override
    public List<Issue> reportCall(HeapSet d, ProcedureId callee, BiAbductionSummary calleeSummary,
                                  CallInstruction call, Location loc) {
        for (SymbolicHeap h : d) {
            int arg = SpecApplier.nullDereferencedArgument(h, calleeSummary, call);
            if (arg >= 0 && SpecApplier.apply(h, calleeSummary, call).isEmpty()) {
                String msg = "call to " + callee + " passes null as argument " + arg
                        + ", which the callee dereferences";
                return Collections.singletonList(new Issue(loc, NULL_DEREFERENCE, msg,
                                                           Collections.singletonList(h.toString())));
            }
        }
        return Collections.emptyList();
    }

    @Override
    public BiAbductionSummary conservativeSummary(ProcedureId id, int arity) {
        return BiAbductionSummary.conservative(arity);
    }

    @Override
    public BiAbductionSummary widenSummary(BiAbductionSummary previous, BiAbductionSummary current) {
        return previous.union(current, config.getMaxSpecs());
    }

    @Override
    public SummaryCodec<BiAbductionSummary> codec() {
        return BiAbductionSummary.CODEC;
    }

    @Override
    public String toString() {
        return "BiAbductionDomain(" + config + ")";
    }

    /**
     * Interprets one instruction on one disjunct
     */
    private static class Transfer implements InstructionVisitor<List<SymbolicHeap>> {

        private final HeapState st;
        /**
         * Allocated objects dropped as garbage by this instruction
         */
        final List<Term> leaked = new ArrayList<>();

        Transfer(HeapState st) {
            this.st = st;
        }

        private List<SymbolicHeap> result(HeapState s) {
            SymbolicHeap h = s.finish();
            if (h == null) {
                return Collections.<SymbolicHeap> emptyList();
            }
            leaked.addAll(Abstraction.leakedObjects(s.garbage));
            return Collections.singletonList(h);
        }

        @Override
        public List<SymbolicHeap> visitLoad(LoadInstruction i) {
            Term base = st.lookup(i.getBase());
            List<SymbolicHeap> res = new ArrayList<>();
            for (HeapState s : st.materialize(base, i.getField())) {
                PointsTo cell = s.cellAt(s.rep(base), i.getField());
                s.assign(i.getTarget(), cell.getTarget());
                res.addAll(result(s));
            }
            return res;
        }

        @Override
        public List<SymbolicHeap> visitStore(StoreInstruction i) {
            Term base = st.lookup(i.getBase());
            Term value = st.eval(i.getValue());
            List<SymbolicHeap> res = new ArrayList<>();
            for (HeapState s : st.materialize(base, i.getField())) {
                PointsTo cell = s.cellAt(s.rep(base), i.getField());
                s.replaceCell(cell, cell.withValue(s.rep(value)));
                res.addAll(result(s));
            }
            return res;
        }

        @Override
        public List<SymbolicHeap> visitAssign(AssignInstruction i) {
            st.assign(i.getTarget(), st.eval(i.getValue()));
            return result(st);
        }

        @Override
        public List<SymbolicHeap> visitAllocate(AllocateInstruction i) {
            st.assign(i.getTarget(), st.allocate());
            return result(st);
        }

        @Override
        public List<SymbolicHeap> visitPrune(PruneInstruction i) {
            Term lhs = st.eval(i.getLhs());
            Term rhs = st.eval(i.getRhs());
            if (i.getOp() == PruneInstruction.Comparison.EQ) {
                st.unify(lhs, rhs);
            }
            else {
                st.addDisequality(lhs, rhs);
            }
            return result(st);
        }

        @Override
        public List<SymbolicHeap> visitCall(CallInstruction i) {
            throw new MalformedInstructionException(i, "calls are interpreted through summaries");
        }

        @Override
        public List<SymbolicHeap> visitReturn(ReturnInstruction i) {
            Operand v = i.getValue();
            if (v != null) {
                st.assign(SymbolicHeap.RETURN, st.eval(v));
            }
            return result(st);
        }
    }
}
