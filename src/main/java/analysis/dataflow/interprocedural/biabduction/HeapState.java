package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import util.WorkQueue;
import analysis.dataflow.interprocedural.biabduction.Term.Symbol;
import analysis.ir.Operand;

/**
 * Mutable working copy of a {@link SymbolicHeap}, used while interpreting one instruction or applying one spec. An
 * operation that finds the state contradictory marks it inconsistent; {@link #finish()} then yields null.
 */
final class HeapState {

    /**
     * Bound on nested list-segment unfoldings for a single access
     */
    private static final int MAX_UNFOLD_DEPTH = 4;

    /**
     * Field of the marker cell <code>obj.$alloc |-> null</code> that records that <code>obj</code> was allocated by
     * the analyzed code
     */
    static final String ALLOC_FIELD = "$alloc";

    final int arity;
    final TreeMap<String, Term> stack;
    final List<HeapAtom> spatial;
    final Set<PureAtom> pure;
    final List<HeapAtom> footprint;
    final Set<PureAtom> footprintPure;
    private int nextFootprint;
    private int nextExistential;
    /**
     * Symbols eliminated by {@link #unify(Term, Term)} and what they were replaced with
     */
    private final Map<Symbol, Term> eliminated;
    private boolean inconsistent = false;
    /**
     * Cells dropped as unreachable by the last {@link #finish()}
     */
    final List<HeapAtom> garbage = new ArrayList<>();

    HeapState(SymbolicHeap h) {
        this.arity = h.getArity();
        this.stack = new TreeMap<>(h.getStack());
        this.spatial = new ArrayList<>(h.getSpatial());
        this.pure = new TreeSet<>(h.getPure());
        this.footprint = new ArrayList<>(h.getFootprint());
        this.footprintPure = new TreeSet<>(h.getFootprintPure());
        this.nextFootprint = h.nextIndex(true);
        this.nextExistential = h.nextIndex(false);
        this.eliminated = new HashMap<>();
    }

    private HeapState(HeapState other) {
        this.arity = other.arity;
        this.stack = new TreeMap<>(other.stack);
        this.spatial = new ArrayList<>(other.spatial);
        this.pure = new TreeSet<>(other.pure);
        this.footprint = new ArrayList<>(other.footprint);
        this.footprintPure = new TreeSet<>(other.footprintPure);
        this.nextFootprint = other.nextFootprint;
        this.nextExistential = other.nextExistential;
        this.eliminated = new HashMap<>(other.eliminated);
        this.inconsistent = other.inconsistent;
    }

    HeapState copy() {
        return new HeapState(this);
    }

    boolean isInconsistent() {
        return inconsistent;
    }

    /**
     * Value of an operand. A variable with no value yet is bound to a fresh existential.
     */
    Term eval(Operand o) {
        if (o instanceof Operand.Variable) {
            String name = ((Operand.Variable) o).getName();
            Term t = stack.get(name);
            if (t == null) {
                t = freshExistential();
                stack.put(name, t);
            }
            return rep(t);
        }
        if (o instanceof Operand.IntConstant) {
            return Term.intConst(((Operand.IntConstant) o).getValue());
        }
        assert o == Operand.NULL : "unknown operand " + o;
        return Term.NULL;
    }

    Term lookup(String var) {
        return eval(Operand.var(var));
    }

    void assign(String var, Term value) {
        stack.put(var, rep(value));
    }

    Symbol freshExistential() {
        return Term.existential(nextExistential++);
    }

    /**
     * New non-null object carrying the allocation marker
     */
    Symbol allocate() {
        Symbol obj = freshExistential();
        spatial.add(new PointsTo(obj, ALLOC_FIELD, Term.NULL));
        return obj;
    }

    static boolean isAllocMarker(HeapAtom a) {
        return a instanceof PointsTo && a.getField().equals(ALLOC_FIELD);
    }

    Symbol freshFootprint() {
        return Term.footprint(nextFootprint++);
    }

    boolean isFormal(Term t) {
        return t instanceof Symbol && ((Symbol) t).isFootprint() && ((Symbol) t).getIndex() < arity;
    }

    private static boolean isFootprintOrConstant(Term t) {
        return t.isConstant() || t instanceof Symbol && ((Symbol) t).isFootprint();
    }

    /**
     * Current name of a term, following eliminations made since this state was created
     */
    Term rep(Term t) {
        while (t instanceof Symbol && eliminated.containsKey(t)) {
            t = eliminated.get(t);
        }
        return t;
    }

    PointsTo cellAt(Term loc, String field) {
        for (HeapAtom a : spatial) {
            if (a instanceof PointsTo && a.getRoot().equals(loc) && a.getField().equals(field)) {
                return (PointsTo) a;
            }
        }
        return null;
    }

    private static boolean hasCell(Collection<HeapAtom> atoms, Term loc) {
        for (HeapAtom a : atoms) {
            if (a instanceof PointsTo && a.getRoot().equals(loc)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasCell(Collection<HeapAtom> atoms, Term loc, String field) {
        for (HeapAtom a : atoms) {
            if (a instanceof PointsTo && a.getRoot().equals(loc) && a.getField().equals(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if <code>t1 != t2</code> follows from the state
     */
    boolean knownDistinct(Term t1, Term t2) {
        t1 = rep(t1);
        t2 = rep(t2);
        if (t1.equals(t2)) {
            return false;
        }
        if (t1.isConstant() && t2.isConstant()) {
            return true;
        }
        PureAtom ne = PureAtom.disequality(t1, t2);
        if (pure.contains(ne) || footprintPure.contains(ne)) {
            return true;
        }
        if (t1.equals(Term.NULL) && hasCell(spatial, t2) || t2.equals(Term.NULL) && hasCell(spatial, t1)) {
            return true;
        }
        // two cells for the same field are disjoint
        for (HeapAtom a : spatial) {
            if (a instanceof PointsTo && a.getRoot().equals(t1) && hasCell(spatial, t2, a.getField())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Assume <code>t1 = t2</code>
     */
    void unify(Term t1, Term t2) {
        t1 = rep(t1);
        t2 = rep(t2);
        if (t1.equals(t2) || inconsistent) {
            return;
        }
        if (knownDistinct(t1, t2)) {
            inconsistent = true;
            return;
        }
        Symbol victim;
        Term survivor;
        if (!(t1 instanceof Symbol)) {
            victim = (Symbol) t2;
            survivor = t1;
        }
        else if (!(t2 instanceof Symbol)) {
            victim = (Symbol) t1;
            survivor = t2;
        }
        else {
            // eliminate existentials before footprint symbols, newer before older
            Symbol s1 = (Symbol) t1;
            Symbol s2 = (Symbol) t2;
            if (s1.isFootprint() != s2.isFootprint()) {
                victim = s1.isFootprint() ? s2 : s1;
            }
            else {
                victim = s1.getIndex() > s2.getIndex() ? s1 : s2;
            }
            survivor = victim == s1 ? s2 : s1;
        }
        Map<Symbol, Term> sigma = Collections.singletonMap(victim, survivor);
        substituteCurrent(sigma);
        if (victim.isFootprint()) {
            substituteFootprint(sigma);
            if (isFormal(victim)) {
                footprintPure.add(PureAtom.equality(victim, survivor));
            }
        }
        eliminated.put(victim, survivor);
    }

    /**
     * Assume <code>t1 != t2</code>
     */
    void addDisequality(Term t1, Term t2) {
        t1 = rep(t1);
        t2 = rep(t2);
        if (inconsistent) {
            return;
        }
        if (t1.equals(t2)) {
            inconsistent = true;
            return;
        }
        if (knownDistinct(t1, t2)) {
            return;
        }
        PureAtom ne = PureAtom.disequality(t1, t2);
        pure.add(ne);
        if (isFootprintOrConstant(t1) && isFootprintOrConstant(t2)) {
            footprintPure.add(ne);
        }
    }

    private void substituteCurrent(Map<Symbol, Term> sigma) {
        for (Map.Entry<String, Term> e : stack.entrySet()) {
            e.setValue(e.getValue().subst(sigma));
        }
        for (int i = 0; i < spatial.size(); i++) {
            spatial.set(i, spatial.get(i).subst(sigma));
        }
        Set<PureAtom> p = new TreeSet<>();
        for (PureAtom a : pure) {
            p.add(a.subst(sigma));
        }
        pure.clear();
        pure.addAll(p);
    }

    private void substituteFootprint(Map<Symbol, Term> sigma) {
        for (int i = 0; i < footprint.size(); i++) {
            footprint.set(i, footprint.get(i).subst(sigma));
        }
        Set<PureAtom> p = new TreeSet<>();
        for (PureAtom a : footprintPure) {
            p.add(a.subst(sigma));
        }
        footprintPure.clear();
        footprintPure.addAll(p);
    }

    /**
     * Make sure the current heap has a cell for <code>loc.field</code>: use an existing cell, unfold a list segment,
     * or add the cell. A missing cell of a footprint location is abduced, i.e. added to the footprint as well; any
     * other missing cell is simply assumed.
     *
     * @param loc
     *            location, not a constant
     * @param field
     *            field
     * @return states in each of which <code>cellAt(rep(loc), field)</code> is not null, empty if the location is null
     */
    List<HeapState> materialize(Term loc, String field) {
        return materialize(loc, field, 0);
    }

    private List<HeapState> materialize(Term loc, String field, int depth) {
        loc = rep(loc);
        if (inconsistent || loc.isConstant()) {
            return Collections.emptyList();
        }
        if (cellAt(loc, field) != null) {
            return Collections.singletonList(this);
        }
        if (depth < MAX_UNFOLD_DEPTH) {
            for (HeapAtom a : spatial) {
                if (a instanceof ListSegment && a.getRoot().equals(loc) && a.getField().equals(field)) {
                    List<HeapState> res = new ArrayList<>();
                    HeapState empty = copy();
                    empty.spatial.remove(a);
                    empty.unify(loc, a.getTarget());
                    if (!empty.inconsistent) {
                        res.addAll(empty.materialize(loc, field, depth + 1));
                    }
                    HeapState nonEmpty = copy();
                    nonEmpty.spatial.remove(a);
                    Symbol next = nonEmpty.freshExistential();
                    nonEmpty.spatial.add(new PointsTo(loc, field, next));
                    nonEmpty.spatial.add(new ListSegment(next, a.getTarget(), field));
                    res.add(nonEmpty);
                    return res;
                }
            }
        }
        Symbol v;
        if (loc instanceof Symbol && ((Symbol) loc).isFootprint() && !hasCell(footprint, loc, field)) {
            v = freshFootprint();
            footprint.add(new PointsTo(loc, field, v));
        }
        else {
            v = freshExistential();
        }
        spatial.add(new PointsTo(loc, field, v));
        return Collections.singletonList(this);
    }

    void replaceCell(PointsTo old, PointsTo cell) {
        int i = spatial.indexOf(old);
        assert i >= 0 : old + " not in " + spatial;
        spatial.set(i, cell);
    }

    /**
     * Forget the cells reachable from the given terms
     */
    void havoc(Collection<Term> from) {
        Set<Term> reach = reachable(new ArrayList<>(from), spatial);
        Iterator<HeapAtom> iter = spatial.iterator();
        while (iter.hasNext()) {
            if (reach.contains(iter.next().getRoot())) {
                iter.remove();
            }
        }
    }

    private static Set<Term> reachable(List<Term> roots, List<HeapAtom> atoms) {
        Set<Term> seen = new HashSet<>();
        WorkQueue<Term> q = new WorkQueue<>();
        for (Term t : roots) {
            if (!t.isConstant()) {
                q.add(t);
            }
        }
        while (!q.isEmpty()) {
            Term t = q.poll();
            if (!seen.add(t)) {
                continue;
            }
            for (HeapAtom a : atoms) {
                if (a.getRoot().equals(t) && !a.getTarget().isConstant() && !seen.contains(a.getTarget())) {
                    q.add(a.getTarget());
                }
            }
        }
        return seen;
    }

    /**
     * Symbols the current heap must keep: stack values and footprint symbols
     */
    private List<Term> gcRoots() {
        List<Term> roots = new ArrayList<>(stack.values());
        for (int i = 0; i < arity; i++) {
            roots.add(Term.footprint(i));
        }
        for (HeapAtom a : footprint) {
            roots.addAll(a.getTerms());
        }
        for (PureAtom p : footprintPure) {
            roots.add(p.getLhs());
            roots.add(p.getRhs());
        }
        return roots;
    }

    /**
     * Normalize: check consistency, drop garbage and redundant constraints, rename symbols canonically
     *
     * @return canonical disjunct, or null if the state is contradictory
     */
    SymbolicHeap finish() {
        if (inconsistent) {
            return null;
        }
        // empty segments, and segments from null which must be empty
        boolean changed = true;
        while (changed) {
            changed = false;
            Iterator<HeapAtom> iter = spatial.iterator();
            while (iter.hasNext()) {
                HeapAtom a = iter.next();
                if (a instanceof ListSegment && rep(a.getRoot()).equals(rep(a.getTarget()))) {
                    iter.remove();
                }
                else if (a instanceof ListSegment && a.getRoot().isConstant()) {
                    iter.remove();
                    unify(a.getRoot(), a.getTarget());
                    changed = true;
                    break;
                }
            }
            if (inconsistent) {
                return null;
            }
        }
        if (!wellFormed(spatial) || !wellFormed(footprint)) {
            return null;
        }

        // garbage: cells unreachable from the stack and the footprint
        Set<Term> live = reachable(gcRoots(), spatial);
        garbage.clear();
        Iterator<HeapAtom> iter = spatial.iterator();
        while (iter.hasNext()) {
            HeapAtom a = iter.next();
            if (!live.contains(a.getRoot())) {
                garbage.add(a);
                iter.remove();
            }
        }
        if (!cleanPure(pure, spatial, live) || !cleanPure(footprintPure, footprint, null)) {
            return null;
        }
        return canonical();
    }

    /**
     * No cell at a constant, no two cells for the same location and field
     */
    private static boolean wellFormed(List<HeapAtom> atoms) {
        Set<String> cells = new HashSet<>();
        for (HeapAtom a : atoms) {
            if (a instanceof PointsTo) {
                if (a.getRoot().isConstant() || !cells.add(a.getRoot() + "." + a.getField())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Remove valid and redundant atoms, and atoms about dead existentials
     *
     * @param live
     *            terms still in use, null to keep all
     * @return false if some atom is unsatisfiable
     */
    private static boolean cleanPure(Set<PureAtom> atoms, List<HeapAtom> heap, Set<Term> live) {
        Iterator<PureAtom> iter = atoms.iterator();
        while (iter.hasNext()) {
            PureAtom p = iter.next();
            if (p.isUnsatisfiable()) {
                return false;
            }
            if (p.isValid()) {
                iter.remove();
                continue;
            }
            if (!p.isEquality() && p.mentions(Term.NULL)) {
                Term other = p.getLhs().equals(Term.NULL) ? p.getRhs() : p.getLhs();
                if (hasCell(heap, other)) {
                    iter.remove();
                    continue;
                }
            }
            if (live != null && (isDeadExistential(p.getLhs(), live) || isDeadExistential(p.getRhs(), live))) {
                iter.remove();
            }
        }
        return true;
    }

    private static boolean isDeadExistential(Term t, Set<Term> live) {
        return t instanceof Symbol && !((Symbol) t).isFootprint() && !live.contains(t);
    }

    private SymbolicHeap canonical() {
        List<Term> roots = new ArrayList<>(stack.values());
        Map<Symbol, Symbol> sigma = Canonicalizer.renaming(arity, roots, Arrays.asList(spatial, footprint),
                                                           Arrays.asList(pure, footprintPure));
        TreeMap<String, Term> s = new TreeMap<>();
        for (Map.Entry<String, Term> e : stack.entrySet()) {
            s.put(e.getKey(), e.getValue().subst(sigma));
        }
        return new SymbolicHeap(arity, s, substAll(spatial, sigma), substPure(pure, sigma),
                                substAll(footprint, sigma), substPure(footprintPure, sigma));
    }

    static List<HeapAtom> substAll(List<HeapAtom> atoms, Map<Symbol, ? extends Term> sigma) {
        List<HeapAtom> res = new ArrayList<>(atoms.size());
        for (HeapAtom a : atoms) {
            res.add(a.subst(sigma));
        }
        return res;
    }

    static TreeSet<PureAtom> substPure(Collection<PureAtom> atoms, Map<Symbol, ? extends Term> sigma) {
        TreeSet<PureAtom> res = new TreeSet<>();
        for (PureAtom a : atoms) {
            res.add(a.subst(sigma));
        }
        return res;
    }

    @Override
    public String toString() {
        return "HeapState{stack=" + stack + ", heap=" + spatial + ", pure=" + pure + ", footprint=" + footprint
                + ", footprintPure=" + footprintPure + (inconsistent ? ", INCONSISTENT" : "") + "}";
    }
}
