package analysis.dataflow.interprocedural.biabduction;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * Spatial atom of a symbolic heap: a single cell or a list segment. Atoms are separated: distinct atoms describe
 * disjoint memory.
 */
public abstract class HeapAtom implements Comparable<HeapAtom> {

    HeapAtom() {
        // only PointsTo and ListSegment
    }

    /**
     * Location the atom starts at
     */
    public abstract Term getRoot();

    /**
     * Field the atom is about
     */
    public abstract String getField();

    /**
     * Term the atom leads to (cell contents or end of segment)
     */
    public abstract Term getTarget();

    public abstract HeapAtom subst(Map<Symbol, ? extends Term> sigma);

    /**
     * Terms mentioned by the atom, root first
     *
     * @return terms
     */
    public List<Term> getTerms() {
        return Arrays.asList(getRoot(), getTarget());
    }

    abstract int rank();

    public abstract JSONObject toJSON();

    public static HeapAtom fromJSON(JSONObject json) {
        if (json.has("pt")) {
            JSONArray a = json.getJSONArray("pt");
            return new PointsTo(Term.fromJSON(a.get(0)), a.getString(1), Term.fromJSON(a.get(2)));
        }
        if (json.has("lseg")) {
            JSONArray a = json.getJSONArray("lseg");
            return new ListSegment(Term.fromJSON(a.get(0)), Term.fromJSON(a.get(1)), a.getString(2));
        }
        throw new JSONException("Not a heap atom: " + json);
    }

    @Override
    public int compareTo(HeapAtom o) {
        int c = getRoot().compareTo(o.getRoot());
        if (c != 0) {
            return c;
        }
        c = getField().compareTo(o.getField());
        if (c != 0) {
            return c;
        }
        c = Integer.compare(rank(), o.rank());
        if (c != 0) {
            return c;
        }
        return getTarget().compareTo(o.getTarget());
    }
}
