package analysis.summary;

/**
 * Converts a domain's summary payload to and from JSON, for the persistent cache and for shipping summaries to worker
 * processes
 *
 * @param <S>
 *            summary payload type
 */
public interface SummaryCodec<S> {

    /**
     * Serialize a payload
     *
     * @param payload
     *            summary payload
     * @return a JSON value ({@link org.json.JSONObject}, {@link org.json.JSONArray}, string, number, boolean)
     */
    Object toJSON(S payload);

    /**
     * Deserialize a payload
     *
     * @param json
     *            value produced by {@link #toJSON(Object)}
     * @return payload
     * @throws org.json.JSONException
     *             if the value is not a serialized payload
     */
    S fromJSON(Object json);
}
