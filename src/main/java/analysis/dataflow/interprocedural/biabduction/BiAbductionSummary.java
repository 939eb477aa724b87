package analysis.dataflow.interprocedural.biabduction;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.summary.SummaryCodec;

/**
 * Summary of a procedure: a set of specs, each describing the procedure's effect when its precondition holds. A
 * caller state is mapped to the disjunction of the results of all applicable specs. No specs means the procedure
 * never returns normally.
 */
public final class BiAbductionSummary {

    public static final SummaryCodec<BiAbductionSummary> CODEC = new SummaryCodec<BiAbductionSummary>() {
        @Override
        public Object toJSON(BiAbductionSummary payload) {
            return payload.toJSON();
        }

        @Override
        public BiAbductionSummary fromJSON(Object json) {
            return BiAbductionSummary.fromJSON((JSONObject) json);
        }
    };

    private final int arity;
    private final SortedSet<Spec> specs;

    public BiAbductionSummary(int arity, Collection<Spec> specs) {
        this.arity = arity;
        this.specs = Collections.unmodifiableSortedSet(new TreeSet<>(specs));
    }

    /**
     * Summary of a procedure about which nothing is known
     *
     * @param arity
     *            number of formals
     * @return summary with the single unknown spec
     */
    public static BiAbductionSummary conservative(int arity) {
        return new BiAbductionSummary(arity, Collections.singleton(Spec.unknown()));
    }

    public int getArity() {
        return arity;
    }

    public SortedSet<Spec> getSpecs() {
        return specs;
    }

    /**
     * Specs of both summaries, keeping the first <code>maxSpecs</code> in canonical order
     */
    public BiAbductionSummary union(BiAbductionSummary other, int maxSpecs) {
        assert other.arity == arity : "arity mismatch " + arity + " vs " + other.arity;
        SortedSet<Spec> all = new TreeSet<>(specs);
        all.addAll(other.specs);
        return new BiAbductionSummary(arity, bound(all, maxSpecs));
    }

    static SortedSet<Spec> bound(SortedSet<Spec> specs, int maxSpecs) {
        if (specs.size() <= maxSpecs) {
            return specs;
        }
        SortedSet<Spec> kept = new TreeSet<>();
        Iterator<Spec> iter = specs.iterator();
        while (kept.size() < maxSpecs) {
            kept.add(iter.next());
        }
        return kept;
    }

    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("arity", arity);
        JSONArray arr = new JSONArray();
        for (Spec s : specs) {
            arr.put(s.toJSON());
        }
        json.put("specs", arr);
        return json;
    }

    public static BiAbductionSummary fromJSON(JSONObject json) {
        JSONArray arr = json.getJSONArray("specs");
        SortedSet<Spec> specs = new TreeSet<>();
        for (int i = 0; i < arr.length(); i++) {
            specs.add(Spec.fromJSON(arr.getJSONObject(i)));
        }
        return new BiAbductionSummary(json.getInt("arity"), specs);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof BiAbductionSummary)) {
            return false;
        }
        BiAbductionSummary other = (BiAbductionSummary) obj;
        return arity == other.arity && specs.equals(other.specs);
    }

    @Override
    public int hashCode() {
        return arity * 31 + specs.hashCode();
    }

    @Override
    public String toString() {
        return "arity " + arity + " " + specs;
    }
}
