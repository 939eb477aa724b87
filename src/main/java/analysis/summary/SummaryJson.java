package analysis.summary;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.Issue;
import analysis.ir.ProcedureId;
import analysis.ir.serialization.IRJson;

/**
 * JSON form of summaries and cache entries, shared by the file store and the worker protocol
 */
public final class SummaryJson {

    private SummaryJson() {
        // static methods only
    }

    public static <S> JSONObject toJSON(Summary<S> summary, SummaryCodec<S> codec) {
        JSONObject json = new JSONObject();
        json.put("procedure", IRJson.toJSON(summary.getProcedure()));
        json.put("key", summary.getKey().toJSON());
        json.put("status", summary.getStatus().name());
        json.put("hash", summary.getHash());
        json.put("payload", codec.toJSON(summary.getPayload()));
        return json;
    }

    /**
     * Read a summary written by {@link #toJSON(Summary, SummaryCodec)}
     *
     * @param json
     *            serialized summary
     * @param codec
     *            payload codec
     * @return summary with the hash that was recorded when it was created
     * @throws JSONException
     *             if the record is malformed
     */
    public static <S> Summary<S> summaryFromJSON(JSONObject json, SummaryCodec<S> codec) {
        ProcedureId proc = IRJson.procedureIdFromJSON(json.getJSONObject("procedure"));
        FreshnessKey key = FreshnessKey.fromJSON(json.getJSONObject("key"));
        SummaryStatus status;
        try {
            status = SummaryStatus.valueOf(json.getString("status"));
        }
        catch (IllegalArgumentException e) {
            throw new JSONException("Unknown summary status " + json.get("status"), e);
        }
        S payload = codec.fromJSON(json.get("payload"));
        return Summary.restore(proc, key, status, payload, json.getString("hash"));
    }

    public static <S> JSONObject toJSON(CacheEntry<S> entry, SummaryCodec<S> codec) {
        JSONObject json = new JSONObject();
        json.put("summary", toJSON(entry.getSummary(), codec));
        json.put("issues", issuesToJSON(entry.getIssues()));
        return json;
    }

    public static <S> CacheEntry<S> entryFromJSON(JSONObject json, SummaryCodec<S> codec) {
        Summary<S> summary = summaryFromJSON(json.getJSONObject("summary"), codec);
        return new CacheEntry<>(summary, issuesFromJSON(json.getJSONArray("issues")));
    }

    public static JSONArray issuesToJSON(List<Issue> issues) {
        JSONArray arr = new JSONArray();
        for (Issue i : issues) {
            arr.put(i.toJSON());
        }
        return arr;
    }

    public static List<Issue> issuesFromJSON(JSONArray arr) {
        List<Issue> issues = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            issues.add(Issue.fromJSON(arr.getJSONObject(i)));
        }
        return issues;
    }
}
