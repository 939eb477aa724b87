package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * List-segment abstraction and the size bounds applied when widening.
 * <p>
 * Two atoms <code>A(a, b, f)</code> and <code>B(b, c, f)</code> (points-to or segment on the same field) are folded
 * into <code>lseg(a, c, f)</code> when <code>b</code> is a symbol that is not a formal, is mentioned by nothing but
 * <code>A</code> and <code>B</code>, and <code>a</code> differs from <code>c</code>. In the current heap "nothing"
 * means the current heap, the stack and the current pure part; in the footprint it means the whole disjunct.
 */
final class Abstraction {

    private Abstraction() {
        // static methods only
    }

    /**
     * Every disjunct of <code>older</code> is kept. New disjuncts are folded and added while there is room for them;
     * those with more than <code>maxAtoms</code> atoms, or beyond <code>maxDisjuncts</code>, are dropped.
     */
    static HeapSet widen(HeapSet older, HeapSet newer, BiAbductionConfig config) {
        List<SymbolicHeap> added = new ArrayList<>();
        int room = config.getMaxDisjuncts() - older.size();
        for (SymbolicHeap h : newer) {
            if (room <= 0) {
                break;
            }
            if (older.getDisjuncts().contains(h)) {
                continue;
            }
            SymbolicHeap f = fold(h);
            if (f != null && f.size() <= config.getMaxAtoms() && !older.getDisjuncts().contains(f)
                    && !added.contains(f)) {
                added.add(f);
                room--;
            }
        }
        return older.join(HeapSet.of(added));
    }

    /**
     * Objects allocated by the analyzed code among the given dropped cells
     */
    static List<Term> leakedObjects(List<HeapAtom> garbage) {
        List<Term> leaked = new ArrayList<>();
        for (HeapAtom a : garbage) {
            if (HeapState.isAllocMarker(a)) {
                leaked.add(a.getRoot());
            }
        }
        return leaked;
    }

    /**
     * Fold list segments in the current heap, then in the footprint
     *
     * @return abstracted disjunct, null if it turned out to be inconsistent
     */
    static SymbolicHeap fold(SymbolicHeap h) {
        HeapState st = h.edit();
        boolean changed = false;
        while (foldOnce(st, st.spatial, false)) {
            changed = true;
        }
        while (foldOnce(st, st.footprint, true)) {
            changed = true;
        }
        return changed ? st.finish() : h;
    }

    private static boolean foldOnce(HeapState st, List<HeapAtom> atoms, boolean inFootprint) {
        for (HeapAtom a : atoms) {
            Term b = a.getTarget();
            if (!(b instanceof Symbol) || st.isFormal(b)) {
                continue;
            }
            for (HeapAtom c : atoms) {
                if (c == a || !c.getRoot().equals(b) || !c.getField().equals(a.getField())
                        || a.getRoot().equals(c.getTarget())) {
                    continue;
                }
                if (mentions(st, b, inFootprint) != 2) {
                    continue;
                }
                atoms.remove(a);
                atoms.remove(c);
                atoms.add(new ListSegment(a.getRoot(), c.getTarget(), a.getField()));
                // b is now inside the segment
                PointsTo marker = st.cellAt(b, HeapState.ALLOC_FIELD);
                if (marker != null) {
                    st.spatial.remove(marker);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * Number of occurrences of a term in the parts of the state that can keep it alive
     */
    private static int mentions(HeapState st, Term b, boolean everywhere) {
        int n = count(st.spatial, b) + countPure(st.pure, b);
        for (Term t : st.stack.values()) {
            if (t.equals(b)) {
                n++;
            }
        }
        if (everywhere) {
            n += count(st.footprint, b) + countPure(st.footprintPure, b);
        }
        return n;
    }

    private static int count(Collection<HeapAtom> atoms, Term b) {
        int n = 0;
        for (HeapAtom a : atoms) {
            if (HeapState.isAllocMarker(a)) {
                continue;
            }
            for (Term t : a.getTerms()) {
                if (t.equals(b)) {
                    n++;
                }
            }
        }
        return n;
    }

    private static int countPure(Collection<PureAtom> atoms, Term b) {
        int n = 0;
        for (PureAtom p : atoms) {
            if (p.mentions(b)) {
                n++;
            }
        }
        return n;
    }
}
