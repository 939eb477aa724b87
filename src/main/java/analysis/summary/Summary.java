package analysis.summary;

import analysis.ir.ProcedureId;
import util.Hashing;

/**
 * Persistable abstraction of a procedure's behavior, used at call sites instead of re-analyzing the callee's body
 *
 * @param <S>
 *            domain specific payload
 */
public final class Summary<S> {

    private final ProcedureId procedure;
    private final FreshnessKey key;
    private final SummaryStatus status;
    private final S payload;
    /**
     * Content hash of the payload, what callers record in their freshness keys. The status is not part of it: a caller
     * analyzed against a payload gets the same result whatever the status of the callee.
     */
    private final String hash;

    private Summary(ProcedureId procedure, FreshnessKey key, SummaryStatus status, S payload, String hash) {
        this.procedure = procedure;
        this.key = key;
        this.status = status;
        this.payload = payload;
        this.hash = hash;
    }

    /**
     * Create a summary, hashing the payload with the given codec
     *
     * @param procedure
     *            procedure summarized
     * @param key
     *            freshness key the summary was computed against
     * @param status
     *            how the summary was obtained
     * @param payload
     *            domain payload
     * @param codec
     *            codec for the payload
     * @return new summary
     */
    public static <S> Summary<S> create(ProcedureId procedure, FreshnessKey key, SummaryStatus status, S payload,
                                        SummaryCodec<S> codec) {
        String hash = Hashing.sha256(String.valueOf(codec.toJSON(payload)));
        return new Summary<>(procedure, key, status, payload, hash);
    }

    /**
     * Recreate a summary read back from storage
     */
    static <S> Summary<S> restore(ProcedureId procedure, FreshnessKey key, SummaryStatus status, S payload,
                                  String hash) {
        return new Summary<>(procedure, key, status, payload, hash);
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public FreshnessKey getKey() {
        return key;
    }

    public SummaryStatus getStatus() {
        return status;
    }

    public S getPayload() {
        return payload;
    }

    public String getHash() {
        return hash;
    }

    /**
     * True if the payload is the same as the other summary's
     *
     * @param other
     *            summary to compare with, may be null
     * @return whether a caller would see the same behavior
     */
    public boolean sameContent(Summary<?> other) {
        return other != null && hash.equals(other.hash);
    }

    @Override
    public String toString() {
        return "Summary(" + procedure + ", " + status + ", " + payload + ")";
    }
}
