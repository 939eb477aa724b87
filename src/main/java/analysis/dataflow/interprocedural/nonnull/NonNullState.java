package analysis.dataflow.interprocedural.nonnull;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Nullness of each local variable at a program point. Variables with no entry are non-null.
 */
public final class NonNullState {

    /**
     * Unreachable code
     */
    public static final NonNullState BOTTOM = new NonNullState(null);

    /**
     * Map from variable name to abstract value, null for {@link #BOTTOM}
     */
    private final SortedMap<String, NonNullAbsVal> locals;

    private NonNullState(SortedMap<String, NonNullAbsVal> locals) {
        this.locals = locals == null ? null : Collections.unmodifiableSortedMap(locals);
    }

    public static NonNullState empty() {
        return new NonNullState(new TreeMap<String, NonNullAbsVal>());
    }

    public boolean isBottom() {
        return locals == null;
    }

    public NonNullAbsVal getLocal(String var) {
        assert !isBottom();
        NonNullAbsVal v = locals.get(var);
        return v == null ? NonNullAbsVal.NON_NULL : v;
    }

    public NonNullState setLocal(String var, NonNullAbsVal val) {
        assert !isBottom();
        if (getLocal(var) == val) {
            return this;
        }
        SortedMap<String, NonNullAbsVal> m = new TreeMap<>(locals);
        if (val.isNonnull()) {
            m.remove(var);
        }
        else {
            m.put(var, val);
        }
        return new NonNullState(m);
    }

    public NonNullState join(NonNullState that) {
        if (that.isBottom()) {
            return this;
        }
        if (this.isBottom()) {
            return that;
        }
        SortedMap<String, NonNullAbsVal> m = new TreeMap<>(locals);
        for (Map.Entry<String, NonNullAbsVal> e : that.locals.entrySet()) {
            m.put(e.getKey(), e.getValue().join(m.get(e.getKey())));
        }
        return new NonNullState(m);
    }

    public boolean leq(NonNullState that) {
        if (this.isBottom()) {
            return true;
        }
        if (that.isBottom()) {
            return false;
        }
        for (Map.Entry<String, NonNullAbsVal> e : locals.entrySet()) {
            if (!e.getValue().leq(that.getLocal(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof NonNullState)) {
            return false;
        }
        NonNullState other = (NonNullState) obj;
        return isBottom() ? other.isBottom() : locals.equals(other.locals);
    }

    @Override
    public int hashCode() {
        return isBottom() ? 0 : locals.hashCode() + 1;
    }

    @Override
    public String toString() {
        return isBottom() ? "BOTTOM" : "MAY_BE_NULL" + locals.keySet();
    }
}
