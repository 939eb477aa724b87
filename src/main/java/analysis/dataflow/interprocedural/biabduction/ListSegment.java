package analysis.dataflow.interprocedural.biabduction;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * <code>lseg(from, to, field)</code>: a possibly empty chain of cells linked through <code>field</code>, starting at
 * <code>from</code> and ending with a cell whose field holds <code>to</code>
 */
public final class ListSegment extends HeapAtom {

    private final Term from;
    private final Term to;
    private final String field;

    public ListSegment(Term from, Term to, String field) {
        this.from = from;
        this.to = to;
        this.field = field;
    }

    @Override
    public Term getRoot() {
        return from;
    }

    @Override
    public String getField() {
        return field;
    }

    @Override
    public Term getTarget() {
        return to;
    }

    @Override
    public ListSegment subst(Map<Symbol, ? extends Term> sigma) {
        return new ListSegment(from.subst(sigma), to.subst(sigma), field);
    }

    @Override
    int rank() {
        return 1;
    }

    @Override
    public JSONObject toJSON() {
        JSONArray a = new JSONArray();
        a.put(from.toJSON());
        a.put(to.toJSON());
        a.put(field);
        JSONObject json = new JSONObject();
        json.put("lseg", a);
        return json;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ListSegment)) {
            return false;
        }
        ListSegment other = (ListSegment) obj;
        return from.equals(other.from) && to.equals(other.to) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
        return ((from.hashCode() * 31 + to.hashCode()) * 31 + field.hashCode()) * 31 + 1;
    }

    @Override
    public String toString() {
        return "lseg(" + from + ", " + to + ", " + field + ")";
    }
}
