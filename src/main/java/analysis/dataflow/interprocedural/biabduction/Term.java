package analysis.dataflow.interprocedural.biabduction;

import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Symbolic value: the null constant, an integer constant, or a symbol. Footprint symbols stand for values that
 * existed when the procedure was entered (the formals' values and cells abduced from them); existential symbols stand
 * for values created during execution. The footprint symbols <code>F0 ... F(n-1)</code> are the values of the n
 * formals.
 */
public abstract class Term implements Comparable<Term> {

    public static final Term NULL = new Null();

    Term() {
        // only the nested subclasses
    }

    public static Term intConst(long value) {
        return new IntConst(value);
    }

    public static Symbol footprint(int index) {
        return new Symbol(true, index);
    }

    public static Symbol existential(int index) {
        return new Symbol(false, index);
    }

    public boolean isConstant() {
        return false;
    }

    /**
     * Apply a substitution
     *
     * @param sigma
     *            map from symbols to terms, symbols not in the map are unchanged
     * @return substituted term
     */
    public Term subst(Map<Symbol, ? extends Term> sigma) {
        return this;
    }

    /**
     * Rank used to order terms of different kinds
     */
    abstract int rank();

    public abstract Object toJSON();

    public static Term fromJSON(Object json) {
        if (json == null || json == JSONObject.NULL) {
            return NULL;
        }
        if (json instanceof Number) {
            return intConst(((Number) json).longValue());
        }
        if (json instanceof String) {
            String s = (String) json;
            if (s.length() > 1 && (s.charAt(0) == 'F' || s.charAt(0) == 'E')) {
                try {
                    int index = Integer.parseInt(s.substring(1));
                    return s.charAt(0) == 'F' ? footprint(index) : existential(index);
                }
                catch (NumberFormatException e) {
                    throw new JSONException("Bad symbol " + s, e);
                }
            }
        }
        throw new JSONException("Not a term: " + json);
    }

    /**
     * The null constant
     */
    public static final class Null extends Term {
        Null() {
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        int rank() {
            return 0;
        }

        @Override
        public Object toJSON() {
            return JSONObject.NULL;
        }

        @Override
        public int compareTo(Term o) {
            return Integer.compare(rank(), o.rank());
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Null;
        }

        @Override
        public int hashCode() {
            return 7;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    /**
     * Integer constant
     */
    public static final class IntConst extends Term {
        private final long value;

        IntConst(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        int rank() {
            return 1;
        }

        @Override
        public Object toJSON() {
            return value;
        }

        @Override
        public int compareTo(Term o) {
            if (o instanceof IntConst) {
                return Long.compare(value, ((IntConst) o).value);
            }
            return Integer.compare(rank(), o.rank());
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntConst && ((IntConst) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value) * 31 + 1;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * Symbolic value
     */
    public static final class Symbol extends Term {
        private final boolean isFootprint;
        private final int index;

        Symbol(boolean isFootprint, int index) {
            assert index >= 0;
            this.isFootprint = isFootprint;
            this.index = index;
        }

        public boolean isFootprint() {
            return isFootprint;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public Term subst(Map<Symbol, ? extends Term> sigma) {
            Term t = sigma.get(this);
            return t == null ? this : t;
        }

        @Override
        int rank() {
            return isFootprint ? 2 : 3;
        }

        @Override
        public Object toJSON() {
            return toString();
        }

        @Override
        public int compareTo(Term o) {
            if (o instanceof Symbol && ((Symbol) o).isFootprint == isFootprint) {
                return Integer.compare(index, ((Symbol) o).index);
            }
            return Integer.compare(rank(), o.rank());
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Symbol)) {
                return false;
            }
            Symbol other = (Symbol) obj;
            return isFootprint == other.isFootprint && index == other.index;
        }

        @Override
        public int hashCode() {
            return index * 4 + (isFootprint ? 2 : 3);
        }

        @Override
        public String toString() {
            return (isFootprint ? "F" : "E") + index;
        }
    }
}
