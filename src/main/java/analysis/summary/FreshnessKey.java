package analysis.summary;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.ir.ProcedureId;
import analysis.ir.serialization.IRJson;

/**
 * The procedure's own code hash combined with the summary hash of each direct callee it was analyzed against. A
 * stored summary is fresh only if its key equals the key recomputed from the current code and callee summaries.
 */
public final class FreshnessKey {

    /**
     * Callee summary hash for callees without a descriptor
     */
    public static final String EXTERNAL = "external";
    /**
     * Callee summary hash for callees that have no summary yet
     */
    public static final String MISSING = "missing";

    private final String codeHash;
    private final Map<ProcedureId, String> calleeHashes;

    public FreshnessKey(String codeHash, Map<ProcedureId, String> calleeHashes) {
        this.codeHash = codeHash;
        this.calleeHashes = Collections.unmodifiableMap(new TreeMap<>(calleeHashes));
    }

    public String getCodeHash() {
        return codeHash;
    }

    /**
     * Summary hash of each direct callee, sorted by callee
     *
     * @return map from callee to the hash of the summary used for it
     */
    public Map<ProcedureId, String> getCalleeHashes() {
        return calleeHashes;
    }

    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("code", codeHash);
        JSONArray callees = new JSONArray();
        for (Map.Entry<ProcedureId, String> e : calleeHashes.entrySet()) {
            JSONObject c = IRJson.toJSON(e.getKey());
            c.put("hash", e.getValue());
            callees.put(c);
        }
        json.put("callees", callees);
        return json;
    }

    public static FreshnessKey fromJSON(JSONObject json) {
        Map<ProcedureId, String> callees = new TreeMap<>();
        JSONArray arr = json.getJSONArray("callees");
        for (int i = 0; i < arr.length(); i++) {
            JSONObject c = arr.getJSONObject(i);
            callees.put(IRJson.procedureIdFromJSON(c), c.getString("hash"));
        }
        return new FreshnessKey(json.getString("code"), callees);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FreshnessKey)) {
            return false;
        }
        FreshnessKey other = (FreshnessKey) obj;
        return codeHash.equals(other.codeHash) && calleeHashes.equals(other.calleeHashes);
    }

    @Override
    public int hashCode() {
        return codeHash.hashCode() * 31 + calleeHashes.hashCode();
    }

    @Override
    public String toString() {
        return "Key(" + codeHash.substring(0, Math.min(8, codeHash.length())) + ", " + calleeHashes.size()
                + " callees)";
    }
}
