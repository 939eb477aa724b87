package analysis.dataflow.util;

/**
 * Element of a lattice used as (part of) a data-flow fact
 *
 * @param <T>
 *            Type of the implementing class (e.g. MyAbsVal implements AbstractValue&lt;MyAbsVal&gt;)
 */
public interface AbstractValue<T> {

    /**
     * Is this abstract value less than or equal to the given abstract value
     *
     * @param that
     *            value to compare
     * @return true if this is less than or equal to that
     */
    boolean leq(T that);

    /**
     * Is this the bottom element
     *
     * @return true if this is the bottom element
     */
    boolean isBottom();

    /**
     * Least upper bound of this abstract value and the given abstract value
     *
     * @param that
     *            value to take the upper bound with, may be null (treated as bottom)
     * @return the upper bound of this and that
     */
    T join(T that);
}
