package analysis.dataflow.interprocedural.biabduction;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * Pure constraint: a disequality, or (in preconditions only) an equality binding a formal's value. Disequalities are
 * kept with the smaller term on the left.
 */
public final class PureAtom implements Comparable<PureAtom> {

    private final boolean isEquality;
    private final Term lhs;
    private final Term rhs;

    private PureAtom(boolean isEquality, Term lhs, Term rhs) {
        this.isEquality = isEquality;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static PureAtom disequality(Term t1, Term t2) {
        return t1.compareTo(t2) <= 0 ? new PureAtom(false, t1, t2) : new PureAtom(false, t2, t1);
    }

    public static PureAtom equality(Symbol formal, Term value) {
        return new PureAtom(true, formal, value);
    }

    public boolean isEquality() {
        return isEquality;
    }

    public Term getLhs() {
        return lhs;
    }

    public Term getRhs() {
        return rhs;
    }

    public boolean mentions(Term t) {
        return lhs.equals(t) || rhs.equals(t);
    }

    /**
     * True if the atom cannot hold (e.g. <code>x != x</code> or <code>1 = 2</code>)
     */
    public boolean isUnsatisfiable() {
        if (isEquality) {
            return lhs.isConstant() && rhs.isConstant() && !lhs.equals(rhs);
        }
        return lhs.equals(rhs);
    }

    /**
     * True if the atom always holds
     */
    public boolean isValid() {
        if (isEquality) {
            return lhs.equals(rhs);
        }
        return lhs.isConstant() && rhs.isConstant() && !lhs.equals(rhs);
    }

    public PureAtom subst(Map<Symbol, ? extends Term> sigma) {
        Term l = lhs.subst(sigma);
        Term r = rhs.subst(sigma);
        if (isEquality) {
            return new PureAtom(true, l, r);
        }
        return disequality(l, r);
    }

    public JSONObject toJSON() {
        JSONArray a = new JSONArray();
        a.put(lhs.toJSON());
        a.put(rhs.toJSON());
        JSONObject json = new JSONObject();
        json.put(isEquality ? "eq" : "ne", a);
        return json;
    }

    public static PureAtom fromJSON(JSONObject json) {
        boolean eq = json.has("eq");
        if (!eq && !json.has("ne")) {
            throw new JSONException("Not a pure atom: " + json);
        }
        JSONArray a = json.getJSONArray(eq ? "eq" : "ne");
        Term l = Term.fromJSON(a.get(0));
        Term r = Term.fromJSON(a.get(1));
        return eq ? new PureAtom(true, l, r) : disequality(l, r);
    }

    @Override
    public int compareTo(PureAtom o) {
        if (isEquality != o.isEquality) {
            return isEquality ? -1 : 1;
        }
        int c = lhs.compareTo(o.lhs);
        return c != 0 ? c : rhs.compareTo(o.rhs);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PureAtom)) {
            return false;
        }
        PureAtom other = (PureAtom) obj;
        return isEquality == other.isEquality && lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return (lhs.hashCode() * 31 + rhs.hashCode()) * 2 + (isEquality ? 1 : 0);
    }

    @Override
    public String toString() {
        return lhs + (isEquality ? " = " : " != ") + rhs;
    }
}
