package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * One disjunct of the abstract state: values of local variables (the stack), the current spatial formula, pure
 * disequalities, and the footprint, i.e. the part of the precondition inferred so far. Instances are normalized and
 * canonical (symbols renamed by first occurrence), so two disjuncts that are equal up to renaming are equal.
 */
public final class SymbolicHeap implements Comparable<SymbolicHeap> {

    /**
     * Stack variable holding the return value
     */
    public static final String RETURN = "$ret";

    private final int arity;
    private final SortedMap<String, Term> stack;
    private final List<HeapAtom> spatial;
    private final SortedSet<PureAtom> pure;
    private final List<HeapAtom> footprint;
    private final SortedSet<PureAtom> footprintPure;
    private final String text;

    SymbolicHeap(int arity, SortedMap<String, Term> stack, List<HeapAtom> spatial, SortedSet<PureAtom> pure,
                 List<HeapAtom> footprint, SortedSet<PureAtom> footprintPure) {
        this.arity = arity;
        this.stack = Collections.unmodifiableSortedMap(new TreeMap<>(stack));
        List<HeapAtom> s = new ArrayList<>(spatial);
        Collections.sort(s);
        this.spatial = Collections.unmodifiableList(s);
        this.pure = Collections.unmodifiableSortedSet(new TreeSet<>(pure));
        List<HeapAtom> f = new ArrayList<>(footprint);
        Collections.sort(f);
        this.footprint = Collections.unmodifiableList(f);
        this.footprintPure = Collections.unmodifiableSortedSet(new TreeSet<>(footprintPure));
        this.text = "{stack=" + this.stack + ", heap=" + this.spatial + ", pure=" + this.pure + ", footprint="
                + this.footprint + ", footprintPure=" + this.footprintPure + "}";
    }

    /**
     * State on entry to a procedure: each formal holds its footprint symbol and nothing else is known
     *
     * @param formals
     *            formal parameter names
     * @return initial disjunct
     */
    public static SymbolicHeap initial(List<String> formals) {
        SortedMap<String, Term> stack = new TreeMap<>();
        for (int i = 0; i < formals.size(); i++) {
            stack.put(formals.get(i), Term.footprint(i));
        }
        return new SymbolicHeap(formals.size(), stack, Collections.<HeapAtom> emptyList(),
                                new TreeSet<PureAtom>(), Collections.<HeapAtom> emptyList(), new TreeSet<PureAtom>());
    }

    /**
     * Mutable copy for interpreting an instruction
     *
     * @return working state
     */
    HeapState edit() {
        return new HeapState(this);
    }

    public int getArity() {
        return arity;
    }

    public SortedMap<String, Term> getStack() {
        return stack;
    }

    public Term lookup(String var) {
        return stack.get(var);
    }

    public List<HeapAtom> getSpatial() {
        return spatial;
    }

    public SortedSet<PureAtom> getPure() {
        return pure;
    }

    public List<HeapAtom> getFootprint() {
        return footprint;
    }

    public SortedSet<PureAtom> getFootprintPure() {
        return footprintPure;
    }

    /**
     * Number of spatial atoms, current and footprint
     */
    public int size() {
        return spatial.size() + footprint.size();
    }

    /**
     * Symbol numbers in use, for allocating fresh symbols
     *
     * @param footprintSymbols
     *            count footprint symbols (otherwise existentials)
     * @return one more than the largest index in use
     */
    int nextIndex(boolean footprintSymbols) {
        int next = footprintSymbols ? arity : 0;
        List<Term> terms = new ArrayList<>(stack.values());
        for (HeapAtom a : spatial) {
            terms.addAll(a.getTerms());
        }
        for (HeapAtom a : footprint) {
            terms.addAll(a.getTerms());
        }
        for (PureAtom p : pure) {
            terms.add(p.getLhs());
            terms.add(p.getRhs());
        }
        for (PureAtom p : footprintPure) {
            terms.add(p.getLhs());
            terms.add(p.getRhs());
        }
        for (Term t : terms) {
            if (t instanceof Symbol && ((Symbol) t).isFootprint() == footprintSymbols) {
                next = Math.max(next, ((Symbol) t).getIndex() + 1);
            }
        }
        return next;
    }

    @Override
    public int compareTo(SymbolicHeap o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SymbolicHeap && ((SymbolicHeap) obj).text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
