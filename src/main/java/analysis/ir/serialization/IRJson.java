package analysis.ir.serialization;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import analysis.ir.AllocateInstruction;
import analysis.ir.AssignInstruction;
import analysis.ir.CFGNode;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.InstructionVisitor;
import analysis.ir.LoadInstruction;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.PruneInstruction;
import analysis.ir.ReturnInstruction;
import analysis.ir.StoreInstruction;

/**
 * JSON form of procedure descriptors, shared by frontends, model files, and the worker protocol.
 *
 * <pre>
 * {"procedures": [
 *   {"name": "A.foo", "signature": "(LA;I)V", "formals": ["p", "c"], "entry": 0, "exit": 3, "model": false,
 *    "nodes": [
 *      {"id": 0, "succs": [1, 2], "instructions": [
 *          {"kind": "load", "target": "x", "base": "p", "field": "f", "line": 12},
 *          {"kind": "store", "base": "p", "field": "f", "value": null},
 *          {"kind": "assign", "target": "x", "value": 1},
 *          {"kind": "allocate", "target": "x", "type": "A"},
 *          {"kind": "prune", "lhs": "c", "op": "NE", "rhs": 0},
 *          {"kind": "call", "target": "r", "callees": [{"name": "A.bar", "signature": "()V"}], "args": ["x"]},
 *          {"kind": "return", "value": "x"}]}]}]}
 * </pre>
 *
 * Operands are a string (variable name), JSON null (the null constant), or an integer.
 */
public class IRJson {

    private IRJson() {
        // static methods only
    }

    /**
     * Read every procedure in the given file
     *
     * @param file
     *            JSON file with a "procedures" array
     * @param isModel
     *            whether the file is a model file (overrides the per-procedure "model" flag when true)
     * @return descriptors in file order
     * @throws IOException
     *             if the file cannot be read
     * @throws JSONException
     *             if the file is not in the expected format
     */
    public static List<ProcedureDescriptor> readFile(Path file, boolean isModel) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return readProcedures(r, isModel);
        }
    }

    public static List<ProcedureDescriptor> readProcedures(Reader r, boolean isModel) {
        JSONObject root = new JSONObject(new JSONTokener(r));
        JSONArray procs = root.getJSONArray("procedures");
        List<ProcedureDescriptor> result = new ArrayList<>(procs.length());
        for (int i = 0; i < procs.length(); i++) {
            result.add(fromJSON(procs.getJSONObject(i), isModel));
        }
        return result;
    }

    /**
     * Write procedures in the format read by {@link #readProcedures(Reader, boolean)}
     *
     * @param procs
     *            procedures to write
     * @param w
     *            destination
     * @throws IOException
     *             on write failure
     */
    public static void writeProcedures(Iterable<ProcedureDescriptor> procs, Writer w) throws IOException {
        JSONArray arr = new JSONArray();
        for (ProcedureDescriptor d : procs) {
            arr.put(toJSON(d));
        }
        JSONObject root = new JSONObject();
        root.put("procedures", arr);
        w.write(root.toString(2));
        w.flush();
    }

    public static JSONObject toJSON(ProcedureId id) {
        JSONObject json = new JSONObject();
        json.put("name", id.getName());
        json.put("signature", id.getSignature());
        return json;
    }

    public static ProcedureId procedureIdFromJSON(JSONObject json) {
        return new ProcedureId(json.getString("name"), json.optString("signature", ""));
    }

    /**
     * Serialize the given descriptor
     *
     * @param d
     *            descriptor to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(ProcedureDescriptor d) {
        JSONObject json = toJSON(d.getId());
        json.put("formals", new JSONArray(d.getFormals()));
        json.put("entry", d.getEntry());
        json.put("exit", d.getExit());
        if (d.isModel()) {
            json.put("model", true);
        }
        JSONArray nodes = new JSONArray();
        for (CFGNode n : d.getNodes()) {
            JSONObject node = new JSONObject();
            node.put("id", n.getId());
            node.put("succs", new JSONArray(n.getSuccs()));
            JSONArray instrs = new JSONArray();
            for (Instruction i : n.getInstructions()) {
                instrs.put(toJSON(i));
            }
            node.put("instructions", instrs);
            nodes.put(node);
        }
        json.put("nodes", nodes);
        return json;
    }

    public static ProcedureDescriptor fromJSON(JSONObject json) {
        return fromJSON(json, false);
    }

    /**
     * Deserialize a descriptor
     *
     * @param json
     *            serialized descriptor
     * @param forceModel
     *            if true the descriptor is marked as coming from a model file
     * @return descriptor
     * @throws JSONException
     *             if a required entry is missing or the graph is malformed
     */
    public static ProcedureDescriptor fromJSON(JSONObject json, boolean forceModel) {
        ProcedureDescriptor.Builder b = ProcedureDescriptor.builder(procedureIdFromJSON(json));
        JSONArray formals = json.optJSONArray("formals");
        if (formals != null) {
            for (int i = 0; i < formals.length(); i++) {
                b.addFormal(formals.getString(i));
            }
        }
        JSONArray nodes = json.getJSONArray("nodes");
        for (int i = 0; i < nodes.length(); i++) {
            JSONObject node = nodes.getJSONObject(i);
            int id = node.getInt("id");
            b.node(id);
            JSONArray instrs = node.optJSONArray("instructions");
            if (instrs != null) {
                for (int j = 0; j < instrs.length(); j++) {
                    b.node(id, instructionFromJSON(instrs.getJSONObject(j)));
                }
            }
            JSONArray succs = node.optJSONArray("succs");
            if (succs != null) {
                for (int j = 0; j < succs.length(); j++) {
                    b.edge(id, succs.getInt(j));
                }
            }
        }
        b.entry(json.getInt("entry"));
        b.exit(json.getInt("exit"));
        b.model(forceModel || json.optBoolean("model", false));
        try {
            return b.build();
        } catch (IllegalStateException e) {
            throw new JSONException(e.getMessage(), e);
        }
    }

    /**
     * Serialize a single instruction
     *
     * @param i
     *            instruction
     * @return JSON form, with a "kind" entry naming the instruction kind
     */
    public static JSONObject toJSON(Instruction i) {
        final JSONObject json = new JSONObject();
        json.put("kind", i.kindName());
        if (i.getLine() != Instruction.NO_LINE) {
            json.put("line", i.getLine());
        }
        i.accept(new InstructionVisitor<Void>() {
            @Override
            public Void visitLoad(LoadInstruction l) {
                json.put("target", l.getTarget());
                json.put("base", l.getBase());
                json.put("field", l.getField());
                return null;
            }

            @Override
            public Void visitStore(StoreInstruction s) {
                json.put("base", s.getBase());
                json.put("field", s.getField());
                json.put("value", toJSON(s.getValue()));
                return null;
            }

            @Override
            public Void visitAssign(AssignInstruction a) {
                json.put("target", a.getTarget());
                json.put("value", toJSON(a.getValue()));
                return null;
            }

            @Override
            public Void visitAllocate(AllocateInstruction a) {
                json.put("target", a.getTarget());
                json.put("type", a.getTypeName());
                return null;
            }

            @Override
            public Void visitPrune(PruneInstruction p) {
                json.put("lhs", toJSON(p.getLhs()));
                json.put("op", p.getOp().name());
                json.put("rhs", toJSON(p.getRhs()));
                return null;
            }

            @Override
            public Void visitCall(CallInstruction c) {
                if (c.getTarget() != null) {
                    json.put("target", c.getTarget());
                }
                JSONArray callees = new JSONArray();
                for (ProcedureId callee : c.getCandidates()) {
                    callees.put(toJSON(callee));
                }
                json.put("callees", callees);
                JSONArray args = new JSONArray();
                for (Operand o : c.getArgs()) {
                    args.put(toJSON(o));
                }
                json.put("args", args);
                return null;
            }

            @Override
            public Void visitReturn(ReturnInstruction r) {
                if (r.getValue() != null) {
                    json.put("value", toJSON(r.getValue()));
                }
                return null;
            }
        });
        return json;
    }

    public static Instruction instructionFromJSON(JSONObject json) {
        String kind = json.getString("kind");
        int line = json.optInt("line", Instruction.NO_LINE);
        switch (kind) {
        case "load":
            return new LoadInstruction(json.getString("target"), json.getString("base"), json.getString("field"),
                    line);
        case "store":
            return new StoreInstruction(json.getString("base"), json.getString("field"),
                    operandFromJSON(json.opt("value")), line);
        case "assign":
            return new AssignInstruction(json.getString("target"), operandFromJSON(json.opt("value")), line);
        case "allocate":
            return new AllocateInstruction(json.getString("target"), json.optString("type", "Object"), line);
        case "prune":
            return new PruneInstruction(operandFromJSON(json.opt("lhs")),
                    PruneInstruction.Comparison.valueOf(json.getString("op")), operandFromJSON(json.opt("rhs")), line);
        case "call":
            List<ProcedureId> callees = new ArrayList<>();
            JSONArray arr = json.getJSONArray("callees");
            for (int i = 0; i < arr.length(); i++) {
                callees.add(procedureIdFromJSON(arr.getJSONObject(i)));
            }
            if (callees.isEmpty()) {
                throw new JSONException("Call without callees: " + json);
            }
            List<Operand> args = new ArrayList<>();
            JSONArray argArr = json.optJSONArray("args");
            if (argArr != null) {
                for (int i = 0; i < argArr.length(); i++) {
                    args.add(operandFromJSON(argArr.opt(i)));
                }
            }
            return new CallInstruction(json.has("target") ? json.getString("target") : null, callees, args, line);
        case "return":
            return new ReturnInstruction(json.has("value") ? operandFromJSON(json.get("value")) : null, line);
        default:
            throw new JSONException("Unknown instruction kind: " + kind);
        }
    }

    public static Object toJSON(Operand o) {
        if (o instanceof Operand.Variable) {
            return ((Operand.Variable) o).getName();
        }
        if (o instanceof Operand.IntConstant) {
            return ((Operand.IntConstant) o).getValue();
        }
        assert o == Operand.NULL : "unknown operand " + o;
        return JSONObject.NULL;
    }

    public static Operand operandFromJSON(Object o) {
        if (o == null || o == JSONObject.NULL) {
            return Operand.NULL;
        }
        if (o instanceof String) {
            return Operand.var((String) o);
        }
        if (o instanceof Number) {
            return Operand.intConst(((Number) o).longValue());
        }
        throw new JSONException("Not an operand: " + o);
    }
}
