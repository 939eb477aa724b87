package analysis.dataflow.interprocedural.biabduction;

/**
 * Bounds that keep the bi-abduction domain finite. Exceeding them loses precision, and in the case of the disjunct
 * and spec bounds also soundness: dropped disjuncts are paths no longer explored.
 */
public class BiAbductionConfig {

    public static final int DEFAULT_MAX_ATOMS = 16;
    public static final int DEFAULT_MAX_DISJUNCTS = 20;
    public static final int DEFAULT_MAX_SPECS = 20;

    /**
     * Widening drops disjuncts with more spatial atoms (current and footprint) than this
     */
    private int maxAtoms = DEFAULT_MAX_ATOMS;
    /**
     * Widening keeps at most this many disjuncts, the first ones in canonical order
     */
    private int maxDisjuncts = DEFAULT_MAX_DISJUNCTS;
    /**
     * Summaries keep at most this many specs
     */
    private int maxSpecs = DEFAULT_MAX_SPECS;

    public int getMaxAtoms() {
        return maxAtoms;
    }

    public BiAbductionConfig setMaxAtoms(int maxAtoms) {
        assert maxAtoms > 0;
        this.maxAtoms = maxAtoms;
        return this;
    }

    public int getMaxDisjuncts() {
        return maxDisjuncts;
    }

    public BiAbductionConfig setMaxDisjuncts(int maxDisjuncts) {
        assert maxDisjuncts > 0;
        this.maxDisjuncts = maxDisjuncts;
        return this;
    }

    public int getMaxSpecs() {
        return maxSpecs;
    }

    public BiAbductionConfig setMaxSpecs(int maxSpecs) {
        assert maxSpecs > 0;
        this.maxSpecs = maxSpecs;
        return this;
    }

    @Override
    public String toString() {
        return "maxAtoms=" + maxAtoms + ", maxDisjuncts=" + maxDisjuncts + ", maxSpecs=" + maxSpecs;
    }
}
