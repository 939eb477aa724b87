package analysis.summary;

/**
 * How a summary was obtained
 */
public enum SummaryStatus {
    /**
     * Fixpoint reached normally
     */
    OK(false),
    /**
     * An iteration cap was hit and a widened result was accepted
     */
    CONVERGENCE_FORCED(false),
    /**
     * Placeholder: an instruction could not be interpreted
     */
    FAILED_MALFORMED(true),
    /**
     * Placeholder: the analysis ran out of time
     */
    TIMED_OUT(true),
    /**
     * Placeholder: the worker died while analyzing the procedure
     */
    CRASHED(true);

    private final boolean isFailure;

    SummaryStatus(boolean isFailure) {
        this.isFailure = isFailure;
    }

    /**
     * True if the summary is a conservative placeholder standing in for a failed analysis
     *
     * @return whether this is a failure status
     */
    public boolean isFailure() {
        return isFailure;
    }
}
