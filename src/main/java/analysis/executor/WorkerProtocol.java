package analysis.executor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.interprocedural.WorkItem;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.serialization.IRJson;
import analysis.summary.SummaryCodec;
import analysis.summary.SummaryJson;
import analysis.summary.SummaryStatus;

/**
 * Messages between the coordinator and worker processes. Each message is one JSON object on one line: the coordinator
 * writes a request to the worker's standard input, the worker answers with a result on its standard output.
 * <p>
 * Request:
 *
 * <pre>
 * {"item": {"procedure": ID, "scc": int, "retries": int, "widen": bool},
 *  "descriptor": PROCEDURE, "summaries": [{"procedure": ID, "payload": ...}],
 *  "scc": [ID], "previous": payload (optional)}
 * </pre>
 *
 * Result:
 *
 * <pre>
 * {"status": "OK", "payload": ..., "issues": [...], "needsAnotherIteration": bool,
 *  "nodeVisits": int, "instructions": int, "message": string (optional)}
 * </pre>
 */
public final class WorkerProtocol<S> {

    private final SummaryCodec<S> codec;

    public WorkerProtocol(SummaryCodec<S> codec) {
        this.codec = codec;
    }

    public JSONObject encodeRequest(WorkRequest<S> req) {
        JSONObject json = new JSONObject();
        WorkItem item = req.getItem();
        JSONObject i = new JSONObject();
        i.put("procedure", IRJson.toJSON(item.getProcedure()));
        i.put("scc", item.getSccIndex());
        i.put("retries", item.getRetries());
        i.put("widen", item.widenSummaries());
        json.put("item", i);
        json.put("descriptor", IRJson.toJSON(req.getDescriptor()));
        JSONArray summaries = new JSONArray();
        for (Map.Entry<ProcedureId, S> e : req.getCallees().getSummaries().entrySet()) {
            JSONObject s = new JSONObject();
            s.put("procedure", IRJson.toJSON(e.getKey()));
            s.put("payload", codec.toJSON(e.getValue()));
            summaries.put(s);
        }
        json.put("summaries", summaries);
        JSONArray scc = new JSONArray();
        for (ProcedureId m : req.getCallees().getSccMembers()) {
            scc.put(IRJson.toJSON(m));
        }
        json.put("scc", scc);
        if (req.getPrevious() != null) {
            json.put("previous", codec.toJSON(req.getPrevious()));
        }
        return json;
    }

    public WorkRequest<S> decodeRequest(JSONObject json) {
        JSONObject i = json.getJSONObject("item");
        WorkItem item = new WorkItem(IRJson.procedureIdFromJSON(i.getJSONObject("procedure")), i.getInt("scc"),
                                     i.getInt("retries"), i.getBoolean("widen"));
        ProcedureDescriptor pd = IRJson.fromJSON(json.getJSONObject("descriptor"));
        Map<ProcedureId, S> summaries = new LinkedHashMap<>();
        JSONArray arr = json.getJSONArray("summaries");
        for (int k = 0; k < arr.length(); k++) {
            JSONObject s = arr.getJSONObject(k);
            summaries.put(IRJson.procedureIdFromJSON(s.getJSONObject("procedure")), codec.fromJSON(s.get("payload")));
        }
        Set<ProcedureId> scc = new LinkedHashSet<>();
        JSONArray members = json.getJSONArray("scc");
        for (int k = 0; k < members.length(); k++) {
            scc.add(IRJson.procedureIdFromJSON(members.getJSONObject(k)));
        }
        S previous = json.has("previous") ? codec.fromJSON(json.get("previous")) : null;
        return new WorkRequest<>(item, pd, new CalleeSummaries<>(summaries, scc), previous);
    }

    public JSONObject encodeResult(WorkResult<S> r) {
        JSONObject json = new JSONObject();
        json.put("status", r.getStatus().name());
        if (r.getPayload() != null) {
            json.put("payload", codec.toJSON(r.getPayload()));
        }
        json.put("issues", SummaryJson.issuesToJSON(r.getIssues()));
        json.put("needsAnotherIteration", r.needsAnotherIteration());
        json.put("nodeVisits", r.getNodeVisits());
        json.put("instructions", r.getInstructions());
        if (r.getMessage() != null) {
            json.put("message", r.getMessage());
        }
        return json;
    }

    public WorkResult<S> decodeResult(JSONObject json) {
        SummaryStatus status = SummaryStatus.valueOf(json.getString("status"));
        S payload = json.has("payload") ? codec.fromJSON(json.get("payload")) : null;
        return new WorkResult<>(status, payload, SummaryJson.issuesFromJSON(json.getJSONArray("issues")),
                                json.getBoolean("needsAnotherIteration"), json.getInt("nodeVisits"),
                                json.getInt("instructions"), json.optString("message", null));
    }
}
