package analysis.dataflow.interprocedural.nonnull;

import org.json.JSONException;

import analysis.dataflow.util.TwoElementSemiLattice;

/**
 * Nullness of a single value
 */
public final class NonNullAbsVal extends TwoElementSemiLattice<NonNullAbsVal> {
    public static final NonNullAbsVal NON_NULL = new NonNullAbsVal(true);
    public static final NonNullAbsVal MAY_BE_NULL = new NonNullAbsVal(false);

    private final boolean notnull;

    private NonNullAbsVal(boolean notnull) {
        this.notnull = notnull;
    }

    /**
     * True if this abstract value represents an object that is definitely not null
     *
     * @return true if definitely not null, false if may be null
     */
    public boolean isNonnull() {
        return notnull;
    }

    @Override
    public NonNullAbsVal getBottom() {
        return NON_NULL;
    }

    @Override
    protected NonNullAbsVal getTop() {
        return MAY_BE_NULL;
    }

    public static NonNullAbsVal fromString(String s) {
        switch (s) {
        case "NON_NULL":
            return NON_NULL;
        case "MAY_BE_NULL":
            return MAY_BE_NULL;
        default:
            throw new JSONException("Not a nullness value: " + s);
        }
    }

    @Override
    public String toString() {
        return this == NON_NULL ? "NON_NULL" : "MAY_BE_NULL";
    }
}
