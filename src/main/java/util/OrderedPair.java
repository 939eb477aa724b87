package util;

/**
 * Immutable pair of the given types.
 * 
 * @param <F>
 *            Type of the first element of the pair
 * @param <S>
 *            Type of the second element of the pair
 */
public class OrderedPair<F, S> {

    /**
     * first element
     */
    private final F fst;
    /**
     * second element
     */
    private final S snd;
    private final int memoizedHashCode;

    /**
     * Create a pair from the two given elements
     * 
     * @param fst
     *            first element of the pair
     * @param snd
     *            second element of the pair
     */
    public OrderedPair(F fst, S snd) {
        this.fst = fst;
        this.snd = snd;
        this.memoizedHashCode = computeHashCode();
    }

    /**
     * Get the first element of the pair
     * 
     * @return first element
     */
    public F fst() {
        return fst;
    }

    /**
     * Get the second element of the pair
     * 
     * @return S second element
     */
    public S snd() {
        return snd;
    }

    /**
     * Replace the first element
     *
     * @param newFst
     *            new first element
     * @return a pair with the given first element and this pair's second element
     */
    public OrderedPair<F, S> withFst(F newFst) {
        return new OrderedPair<>(newFst, snd);
    }

    /**
     * Replace the second element
     *
     * @param newSnd
     *            new second element
     * @return a pair with this pair's first element and the given second element
     */
    public OrderedPair<F, S> withSnd(S newSnd) {
        return new OrderedPair<>(fst, newSnd);
    }

    private int computeHashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + (fst == null ? 0 : fst.hashCode());
        result = prime * result + (snd == null ? 0 : snd.hashCode());
        return result;
    }

    /**
     * Two {@link OrderedPair}s are equal if their constituent parts are equal.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OrderedPair)) {
            return false;
        }
        OrderedPair<?, ?> other = (OrderedPair<?, ?>) obj;
        if (memoizedHashCode != other.memoizedHashCode) {
            return false;
        }
        if (fst == null ? other.fst != null : !fst.equals(other.fst)) {
            return false;
        }
        return snd == null ? other.snd == null : snd.equals(other.snd);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        return "(" + fst + ", " + snd + ")";
    }
}
