package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import util.WorkQueue;
import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * Renames symbols by order of first occurrence so that formulas equal up to renaming become equal. The formals'
 * symbols keep their names. Occurrence order: the root terms in the given order, then the atoms reachable from named
 * symbols (breadth first, atoms of one root ordered by field), then the remaining atoms and pure atoms ordered by
 * their text with unnamed symbols blanked out.
 */
final class Canonicalizer {

    private final Map<Symbol, Symbol> renaming = new LinkedHashMap<>();
    private final WorkQueue<Symbol> toExplore = new WorkQueue<>();
    private int nextFootprint;
    private int nextExistential = 0;

    private Canonicalizer(int arity) {
        this.nextFootprint = arity;
        for (int i = 0; i < arity; i++) {
            Symbol f = Term.footprint(i);
            renaming.put(f, f);
        }
    }

    /**
     * Compute the renaming
     *
     * @param arity
     *            number of formals, symbols F0 ... F(arity-1) are fixed
     * @param roots
     *            terms named first, in order
     * @param atomGroups
     *            spatial formulas (e.g. current heap and footprint)
     * @param pure
     *            pure formulas
     * @return map from every symbol occurring in the input to its new name
     */
    static Map<Symbol, Symbol> renaming(int arity, List<Term> roots, List<? extends Collection<HeapAtom>> atomGroups,
                                        List<? extends Collection<PureAtom>> pure) {
        Canonicalizer c = new Canonicalizer(arity);
        for (int i = 0; i < arity; i++) {
            c.toExplore.add(Term.footprint(i));
        }
        for (Term t : roots) {
            c.visit(t);
        }
        List<HeapAtom> atoms = new ArrayList<>();
        for (Collection<HeapAtom> g : atomGroups) {
            atoms.addAll(g);
        }
        boolean[] done = new boolean[atoms.size()];
        while (true) {
            c.explore(atoms, done);
            // atoms not reachable from anything named so far
            List<Integer> rest = new ArrayList<>();
            for (int i = 0; i < atoms.size(); i++) {
                if (!done[i]) {
                    rest.add(i);
                }
            }
            if (rest.isEmpty()) {
                break;
            }
            final List<HeapAtom> all = atoms;
            final Canonicalizer cc = c;
            Collections.sort(rest, new Comparator<Integer>() {
                @Override
                public int compare(Integer o1, Integer o2) {
                    return cc.key(all.get(o1)).compareTo(cc.key(all.get(o2)));
                }
            });
            int first = rest.get(0);
            done[first] = true;
            c.visit(atoms.get(first).getRoot());
            c.visit(atoms.get(first).getTarget());
        }
        List<PureAtom> ps = new ArrayList<>();
        for (Collection<PureAtom> g : pure) {
            ps.addAll(g);
        }
        final Canonicalizer cc = c;
        Collections.sort(ps, new Comparator<PureAtom>() {
            @Override
            public int compare(PureAtom o1, PureAtom o2) {
                return cc.key(o1).compareTo(cc.key(o2));
            }
        });
        for (PureAtom p : ps) {
            c.visit(p.getLhs());
            c.visit(p.getRhs());
        }
        return c.renaming;
    }

    private void visit(Term t) {
        if (!(t instanceof Symbol) || renaming.containsKey(t)) {
            return;
        }
        Symbol s = (Symbol) t;
        Symbol n = s.isFootprint() ? Term.footprint(nextFootprint++) : Term.existential(nextExistential++);
        renaming.put(s, n);
        toExplore.add(s);
    }

    /**
     * Name everything reachable from the named symbols
     */
    private void explore(List<HeapAtom> atoms, boolean[] done) {
        while (!toExplore.isEmpty()) {
            Symbol s = toExplore.poll();
            List<Integer> out = new ArrayList<>();
            for (int i = 0; i < atoms.size(); i++) {
                if (!done[i] && atoms.get(i).getRoot().equals(s)) {
                    out.add(i);
                }
            }
            final List<HeapAtom> all = atoms;
            Collections.sort(out, new Comparator<Integer>() {
                @Override
                public int compare(Integer o1, Integer o2) {
                    return key(all.get(o1)).compareTo(key(all.get(o2)));
                }
            });
            for (int i : out) {
                done[i] = true;
                visit(atoms.get(i).getTarget());
            }
        }
    }

    private String name(Term t) {
        if (t instanceof Symbol) {
            Symbol n = renaming.get(t);
            return n == null ? (((Symbol) t).isFootprint() ? "F?" : "E?") : n.toString();
        }
        return t.toString();
    }

    String key(HeapAtom a) {
        return name(a.getRoot()) + "." + a.getField() + (a instanceof PointsTo ? "|->" : "~>") + name(a.getTarget());
    }

    String key(PureAtom p) {
        return name(p.getLhs()) + (p.isEquality() ? "=" : "!=") + name(p.getRhs());
    }
}
