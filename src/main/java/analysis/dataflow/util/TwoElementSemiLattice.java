package analysis.dataflow.util;

/**
 * Abstract value that is a partially ordered set of two elements with a join operation. The lattice has finite height
 * so joining is also a valid widening.
 */
public abstract class TwoElementSemiLattice<T extends AbstractValue<T>> implements AbstractValue<T> {

    @Override
    public boolean leq(T that) {
        assert that != null;
        return this.isBottom() || !that.isBottom();
    }

    @Override
    public T join(T that) {
        if (that == null || that.isBottom()) {
            return this.isBottom() ? getBottom() : getTop();
        }
        return getTop();
    }

    @Override
    public final boolean isBottom() {
        return this.equals(getBottom());
    }

    public final boolean isTop() {
        return this.equals(getTop());
    }

    /**
     * Get the top element of the semi-lattice
     *
     * @return top abstract value
     */
    protected abstract T getTop();

    /**
     * Get the bottom element of the semi-lattice
     *
     * @return bottom abstract value
     */
    protected abstract T getBottom();
}
