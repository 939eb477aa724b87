package analysis.dataflow.interprocedural.biabduction;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * <code>loc.field |-&gt; value</code>: the field of the cell at <code>loc</code> holds <code>value</code>
 */
public final class PointsTo extends HeapAtom {

    private final Term loc;
    private final String field;
    private final Term value;

    public PointsTo(Term loc, String field, Term value) {
        this.loc = loc;
        this.field = field;
        this.value = value;
    }

    @Override
    public Term getRoot() {
        return loc;
    }

    @Override
    public String getField() {
        return field;
    }

    @Override
    public Term getTarget() {
        return value;
    }

    public PointsTo withValue(Term newValue) {
        return new PointsTo(loc, field, newValue);
    }

    @Override
    public PointsTo subst(Map<Symbol, ? extends Term> sigma) {
        return new PointsTo(loc.subst(sigma), field, value.subst(sigma));
    }

    @Override
    int rank() {
        return 0;
    }

    @Override
    public JSONObject toJSON() {
        JSONArray a = new JSONArray();
        a.put(loc.toJSON());
        a.put(field);
        a.put(value.toJSON());
        JSONObject json = new JSONObject();
        json.put("pt", a);
        return json;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PointsTo)) {
            return false;
        }
        PointsTo other = (PointsTo) obj;
        return loc.equals(other.loc) && field.equals(other.field) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return (loc.hashCode() * 31 + field.hashCode()) * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return loc + "." + field + "|->" + value;
    }
}
