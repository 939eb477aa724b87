package analysis.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.ir.Location;
import analysis.ir.ProcedureId;
import analysis.ir.serialization.IRJson;

/**
 * Diagnostic reported by a checker. The engine collects these and hands them to the issue-formatting collaborator
 * without formatting or filtering them.
 */
public final class Issue {

    private final Location location;
    private final String kind;
    private final String message;
    private final List<String> trace;

    /**
     * Create a new issue
     *
     * @param location
     *            instruction the issue is reported at
     * @param kind
     *            kind of defect, e.g. "NULL_DEREFERENCE"
     * @param message
     *            human readable description
     * @param trace
     *            steps leading to the defect, outermost first
     */
    public Issue(Location location, String kind, String message, List<String> trace) {
        this.location = location;
        this.kind = kind;
        this.message = message;
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
    }

    public ProcedureId getProcedure() {
        return location.getProcedure();
    }

    public Location getLocation() {
        return location;
    }

    public String getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getTrace() {
        return trace;
    }

    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("procedure", IRJson.toJSON(location.getProcedure()));
        JSONObject loc = new JSONObject();
        loc.put("node", location.getNode());
        loc.put("index", location.getIndex());
        loc.put("line", location.getLine());
        json.put("location", loc);
        json.put("kind", kind);
        json.put("message", message);
        json.put("trace", new JSONArray(trace));
        return json;
    }

    public static Issue fromJSON(JSONObject json) {
        ProcedureId proc = IRJson.procedureIdFromJSON(json.getJSONObject("procedure"));
        JSONObject loc = json.getJSONObject("location");
        List<String> trace = new ArrayList<>();
        JSONArray arr = json.optJSONArray("trace");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                trace.add(arr.getString(i));
            }
        }
        return new Issue(new Location(proc, loc.getInt("node"), loc.getInt("index"), loc.getInt("line")),
                json.getString("kind"), json.getString("message"), trace);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Issue)) {
            return false;
        }
        Issue other = (Issue) obj;
        return location.equals(other.location) && kind.equals(other.kind) && message.equals(other.message)
                && trace.equals(other.trace);
    }

    @Override
    public int hashCode() {
        return (location.hashCode() * 31 + kind.hashCode()) * 31 + message.hashCode();
    }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
