package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import analysis.dataflow.MalformedInstructionException;
import analysis.dataflow.interprocedural.biabduction.Term.Symbol;
import analysis.ir.CallInstruction;
import analysis.ir.Operand;

/**
 * Applies a callee summary to one caller disjunct. For each spec the precondition is matched against the caller
 * heap: matched cells are removed (they are the callee's footprint), cells the caller lacks are abduced when rooted at
 * footprint symbols. The postcondition is then added with fresh existentials and the return value is bound. A spec
 * whose precondition contradicts the caller is skipped.
 */
final class SpecApplier {

    /**
     * Partial match: caller state and the values bound to the spec's symbols so far
     */
    private static final class Match {
        final HeapState state;
        final Map<Symbol, Term> binding;

        Match(HeapState state, Map<Symbol, Term> binding) {
            this.state = state;
            this.binding = binding;
        }

        Match copy() {
            return new Match(state.copy(), new HashMap<>(binding));
        }

        /**
         * Caller term for a spec term, null if the symbol is not bound yet
         */
        Term value(Term t) {
            if (t.isConstant()) {
                return t;
            }
            Term v = binding.get(t);
            return v == null ? null : state.rep(v);
        }

        /**
         * Bind or check
         */
        void equate(Term specTerm, Term callerTerm) {
            Term v = value(specTerm);
            if (v == null) {
                binding.put((Symbol) specTerm, callerTerm);
            }
            else {
                state.unify(v, callerTerm);
            }
        }
    }

    private SpecApplier() {
        // static methods only
    }

    /**
     * Disjuncts after the call
     *
     * @param caller
     *            caller disjunct before the call
     * @param summary
     *            summary of one candidate callee
     * @param call
     *            call instruction
     * @return caller disjuncts after the call, empty if no spec applies
     */
    static List<SymbolicHeap> apply(SymbolicHeap caller, BiAbductionSummary summary, CallInstruction call) {
        List<Operand> args = call.getArgs();
        if (args.size() != summary.getArity()) {
            throw new MalformedInstructionException(call, "call passes " + args.size() + " arguments to a procedure with "
                    + summary.getArity() + " formals");
        }
        List<SymbolicHeap> result = new ArrayList<>();
        for (Spec spec : summary.getSpecs()) {
            HeapState st = caller.edit();
            Map<Symbol, Term> binding = new HashMap<>();
            List<Term> actuals = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                Term a = st.eval(args.get(i));
                actuals.add(a);
                binding.put(Term.footprint(i), a);
            }
            for (Match m : matchPre(new Match(st, binding), spec)) {
                SymbolicHeap h = addPost(m, spec, actuals, call.getTarget());
                if (h != null) {
                    result.add(h);
                }
            }
        }
        return result;
    }

    /**
     * Index of an argument that is null in the caller while some spec of the callee requires a cell at the
     * corresponding formal
     *
     * @return argument index, -1 if there is none
     */
    static int nullDereferencedArgument(SymbolicHeap caller, BiAbductionSummary summary, CallInstruction call) {
        HeapState st = caller.edit();
        List<Operand> args = call.getArgs();
        for (int i = 0; i < args.size() && i < summary.getArity(); i++) {
            if (!st.eval(args.get(i)).equals(Term.NULL)) {
                continue;
            }
            for (Spec spec : summary.getSpecs()) {
                for (HeapAtom a : spec.getPre()) {
                    if (a instanceof PointsTo && a.getRoot().equals(Term.footprint(i))) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    /**
     * Match the spatial and pure precondition
     *
     * @return consistent matches, empty if the spec does not apply
     */
    private static List<Match> matchPre(Match start, Spec spec) {
        List<Match> matches = new ArrayList<>();
        matches.add(start);
        // atoms are matched once their root is bound
        LinkedList<HeapAtom> remaining = new LinkedList<>(spec.getPre());
        while (!remaining.isEmpty() && !matches.isEmpty()) {
            HeapAtom next = null;
            for (HeapAtom a : remaining) {
                if (matches.get(0).value(a.getRoot()) != null) {
                    next = a;
                    break;
                }
            }
            if (next == null) {
                // precondition not connected to the arguments
                return new ArrayList<>();
            }
            remaining.remove(next);
            List<Match> nextMatches = new ArrayList<>();
            for (Match m : matches) {
                if (next instanceof PointsTo) {
                    matchPointsTo(m, (PointsTo) next, nextMatches);
                }
                else {
                    matchSegment(m, (ListSegment) next, nextMatches);
                }
            }
            matches = nextMatches;
        }

        List<Match> consistent = new ArrayList<>();
        for (Match m : matches) {
            for (PureAtom p : spec.getPrePure()) {
                Term l = bindFresh(m, p.getLhs());
                Term r = bindFresh(m, p.getRhs());
                if (p.isEquality()) {
                    m.state.unify(l, r);
                }
                else {
                    m.state.addDisequality(l, r);
                }
            }
            if (!m.state.isInconsistent()) {
                consistent.add(m);
            }
        }
        return consistent;
    }

    private static void matchPointsTo(Match m, PointsTo a, List<Match> out) {
        Term loc = m.value(a.getRoot());
        for (HeapState s : m.state.materialize(loc, a.getField())) {
            Match n = s == m.state ? m : new Match(s, new HashMap<>(m.binding));
            PointsTo cell = n.state.cellAt(n.state.rep(loc), a.getField());
            n.state.spatial.remove(cell);
            n.equate(a.getTarget(), cell.getTarget());
            if (!n.state.isInconsistent()) {
                out.add(n);
            }
        }
    }

    private static void matchSegment(Match m, ListSegment a, List<Match> out) {
        Term from = m.value(a.getRoot());
        for (HeapAtom c : m.state.spatial) {
            if (c instanceof ListSegment && c.getRoot().equals(from) && c.getField().equals(a.getField())) {
                Match n = m.copy();
                n.state.spatial.remove(c);
                n.equate(a.getTarget(), c.getTarget());
                if (!n.state.isInconsistent()) {
                    out.add(n);
                }
                return;
            }
        }
        // no segment in the caller: the callee's segment is empty
        m.equate(a.getTarget(), from);
        if (!m.state.isInconsistent()) {
            out.add(m);
        }
    }

    private static Term bindFresh(Match m, Term specTerm) {
        Term v = m.value(specTerm);
        if (v == null) {
            v = m.state.freshExistential();
            m.binding.put((Symbol) specTerm, v);
        }
        return v;
    }

    private static SymbolicHeap addPost(Match m, Spec spec, List<Term> actuals, String target) {
        HeapState st = m.state;
        if (spec.isHavoc()) {
            List<Term> roots = new ArrayList<>();
            for (Term a : actuals) {
                roots.add(st.rep(a));
            }
            st.havoc(roots);
        }
        for (HeapAtom a : spec.getPost()) {
            Term root = bindFresh(m, a.getRoot());
            Term t = bindFresh(m, a.getTarget());
            if (a instanceof PointsTo) {
                st.spatial.add(new PointsTo(root, a.getField(), t));
            }
            else {
                st.spatial.add(new ListSegment(root, t, a.getField()));
            }
        }
        for (PureAtom p : spec.getPostPure()) {
            Term l = bindFresh(m, p.getLhs());
            Term r = bindFresh(m, p.getRhs());
            if (p.isEquality()) {
                st.unify(l, r);
            }
            else {
                st.addDisequality(l, r);
            }
        }
        if (target != null) {
            st.assign(target, spec.getReturn() == null ? st.freshExistential() : bindFresh(m, spec.getReturn()));
        }
        return st.finish();
    }
}
