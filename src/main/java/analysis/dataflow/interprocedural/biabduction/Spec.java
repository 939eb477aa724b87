package analysis.dataflow.interprocedural.biabduction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONObject;

import util.WorkQueue;
import analysis.dataflow.interprocedural.biabduction.Term.Symbol;

/**
 * Hoare triple <code>{pre} proc {post}</code> over the formals. Symbols <code>F0 ... F(arity-1)</code> are the
 * formals, other footprint symbols are values found in the caller's heap by the precondition, existential symbols
 * are values created by the procedure.
 */
public final class Spec implements Comparable<Spec> {

    private final List<HeapAtom> pre;
    private final SortedSet<PureAtom> prePure;
    private final List<HeapAtom> post;
    private final SortedSet<PureAtom> postPure;
    /**
     * Return value, null if unknown or the procedure returns nothing
     */
    private final Term ret;
    /**
     * If true the callee may have written any cell reachable from its arguments
     */
    private final boolean havoc;
    private final String text;

    Spec(List<HeapAtom> pre, Collection<PureAtom> prePure, List<HeapAtom> post, Collection<PureAtom> postPure,
         Term ret, boolean havoc) {
        List<HeapAtom> p = new ArrayList<>(pre);
        Collections.sort(p);
        this.pre = Collections.unmodifiableList(p);
        this.prePure = Collections.unmodifiableSortedSet(new TreeSet<>(prePure));
        List<HeapAtom> q = new ArrayList<>(post);
        Collections.sort(q);
        this.post = Collections.unmodifiableList(q);
        this.postPure = Collections.unmodifiableSortedSet(new TreeSet<>(postPure));
        this.ret = ret;
        this.havoc = havoc;
        this.text = "{" + this.pre + (this.prePure.isEmpty() ? "" : " & " + this.prePure) + "} {" + this.post
                + (this.postPure.isEmpty() ? "" : " & " + this.postPure) + (ret == null ? "" : " & ret=" + ret)
                + "}" + (havoc ? " havoc" : "");
    }

    /**
     * Spec of an unknown procedure: no requirement, unknown result, argument cells forgotten
     */
    static Spec unknown() {
        return new Spec(Collections.<HeapAtom> emptyList(), Collections.<PureAtom> emptySet(),
                        Collections.<HeapAtom> emptyList(), Collections.<PureAtom> emptySet(), null, true);
    }

    /**
     * Spec described by one exit disjunct. The precondition is the footprint. The postcondition is the part of the
     * current heap reachable from the formals, the values in the precondition, and the return value.
     *
     * @param h
     *            disjunct at the exit of the procedure
     * @return canonical spec
     */
    static Spec fromExitState(SymbolicHeap h) {
        Term ret = h.lookup(SymbolicHeap.RETURN);
        Set<Term> roots = new HashSet<>();
        for (int i = 0; i < h.getArity(); i++) {
            roots.add(Term.footprint(i));
        }
        for (HeapAtom a : h.getFootprint()) {
            roots.addAll(a.getTerms());
        }
        for (PureAtom p : h.getFootprintPure()) {
            roots.add(p.getLhs());
            roots.add(p.getRhs());
        }
        if (ret != null) {
            roots.add(ret);
        }

        Set<Term> live = new HashSet<>();
        WorkQueue<Term> q = new WorkQueue<>();
        q.addAll(roots);
        while (!q.isEmpty()) {
            Term t = q.poll();
            if (!live.add(t)) {
                continue;
            }
            for (HeapAtom a : h.getSpatial()) {
                if (a.getRoot().equals(t)) {
                    q.add(a.getTarget());
                }
            }
        }
        List<HeapAtom> post = new ArrayList<>();
        for (HeapAtom a : h.getSpatial()) {
            if (live.contains(a.getRoot())) {
                post.add(a);
            }
        }
        List<PureAtom> postPure = new ArrayList<>();
        for (PureAtom p : h.getPure()) {
            if ((p.getLhs().isConstant() || live.contains(p.getLhs()))
                    && (p.getRhs().isConstant() || live.contains(p.getRhs()))) {
                postPure.add(p);
            }
        }
        return canonical(h.getArity(), h.getFootprint(), h.getFootprintPure(), post, postPure, ret, false);
    }

    static Spec canonical(int arity, List<HeapAtom> pre, Collection<PureAtom> prePure, List<HeapAtom> post,
                          Collection<PureAtom> postPure, Term ret, boolean havoc) {
        List<Term> roots = new ArrayList<>();
        if (ret != null) {
            roots.add(ret);
        }
        Map<Symbol, Symbol> sigma = Canonicalizer.renaming(arity, roots, Arrays.asList(pre, post),
                                                           Arrays.asList(prePure, postPure));
        return new Spec(HeapState.substAll(pre, sigma), HeapState.substPure(prePure, sigma),
                        HeapState.substAll(post, sigma), HeapState.substPure(postPure, sigma),
                        ret == null ? null : ret.subst(sigma), havoc);
    }

    public List<HeapAtom> getPre() {
        return pre;
    }

    public SortedSet<PureAtom> getPrePure() {
        return prePure;
    }

    public List<HeapAtom> getPost() {
        return post;
    }

    public SortedSet<PureAtom> getPostPure() {
        return postPure;
    }

    public Term getReturn() {
        return ret;
    }

    public boolean isHavoc() {
        return havoc;
    }

    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("pre", atomsToJSON(pre));
        json.put("prePure", pureToJSON(prePure));
        json.put("post", atomsToJSON(post));
        json.put("postPure", pureToJSON(postPure));
        if (ret != null) {
            json.put("ret", ret.toJSON());
        }
        json.put("havoc", havoc);
        return json;
    }

    public static Spec fromJSON(JSONObject json) {
        return new Spec(atomsFromJSON(json.getJSONArray("pre")), pureFromJSON(json.getJSONArray("prePure")),
                        atomsFromJSON(json.getJSONArray("post")), pureFromJSON(json.getJSONArray("postPure")),
                        json.has("ret") ? Term.fromJSON(json.get("ret")) : null, json.optBoolean("havoc", false));
    }

    private static JSONArray atomsToJSON(List<HeapAtom> atoms) {
        JSONArray arr = new JSONArray();
        for (HeapAtom a : atoms) {
            arr.put(a.toJSON());
        }
        return arr;
    }

    private static List<HeapAtom> atomsFromJSON(JSONArray arr) {
        List<HeapAtom> atoms = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            atoms.add(HeapAtom.fromJSON(arr.getJSONObject(i)));
        }
        return atoms;
    }

    private static JSONArray pureToJSON(Collection<PureAtom> atoms) {
        JSONArray arr = new JSONArray();
        for (PureAtom a : atoms) {
            arr.put(a.toJSON());
        }
        return arr;
    }

    private static List<PureAtom> pureFromJSON(JSONArray arr) {
        List<PureAtom> atoms = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            atoms.add(PureAtom.fromJSON(arr.getJSONObject(i)));
        }
        return atoms;
    }

    @Override
    public int compareTo(Spec o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Spec && ((Spec) obj).text.equals(text);
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
