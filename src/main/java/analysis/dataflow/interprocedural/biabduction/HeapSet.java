package analysis.dataflow.interprocedural.biabduction;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Abstract state of the bi-abduction domain: a finite disjunction of canonical symbolic heaps. The empty disjunction
 * is unreachable code.
 */
public final class HeapSet implements Iterable<SymbolicHeap> {

    public static final HeapSet EMPTY = new HeapSet(new TreeSet<SymbolicHeap>());

    private final SortedSet<SymbolicHeap> disjuncts;

    private HeapSet(SortedSet<SymbolicHeap> disjuncts) {
        this.disjuncts = Collections.unmodifiableSortedSet(disjuncts);
    }

    public static HeapSet of(Collection<SymbolicHeap> disjuncts) {
        if (disjuncts.isEmpty()) {
            return EMPTY;
        }
        return new HeapSet(new TreeSet<>(disjuncts));
    }

    public static HeapSet of(SymbolicHeap h) {
        return of(Collections.singleton(h));
    }

    public SortedSet<SymbolicHeap> getDisjuncts() {
        return disjuncts;
    }

    public boolean isBottom() {
        return disjuncts.isEmpty();
    }

    public int size() {
        return disjuncts.size();
    }

    @Override
    public Iterator<SymbolicHeap> iterator() {
        return disjuncts.iterator();
    }

    public HeapSet join(HeapSet other) {
        if (other.disjuncts.containsAll(disjuncts)) {
            return other;
        }
        if (disjuncts.containsAll(other.disjuncts)) {
            return this;
        }
        SortedSet<SymbolicHeap> s = new TreeSet<>(disjuncts);
        s.addAll(other.disjuncts);
        return new HeapSet(s);
    }

    public boolean leq(HeapSet other) {
        return other.disjuncts.containsAll(disjuncts);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HeapSet && ((HeapSet) obj).disjuncts.equals(disjuncts);
    }

    @Override
    public int hashCode() {
        return disjuncts.hashCode();
    }

    @Override
    public String toString() {
        if (disjuncts.isEmpty()) {
            return "false";
        }
        StringBuilder sb = new StringBuilder();
        for (SymbolicHeap h : disjuncts) {
            if (sb.length() > 0) {
                sb.append("\n\t\\/ ");
            }
            sb.append(h);
        }
        return sb.toString();
    }
}
