package main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONObject;
import org.junit.Test;

import analysis.ExamplePrograms;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.Checker;
import analysis.dataflow.interprocedural.EngineConfig;
import analysis.dataflow.interprocedural.WorkItem;
import analysis.dataflow.interprocedural.biabduction.BiAbductionDomain;
import analysis.dataflow.interprocedural.biabduction.BiAbductionSummary;
import analysis.dataflow.interprocedural.biabduction.HeapSet;
import analysis.executor.WorkRequest;
import analysis.executor.WorkResult;
import analysis.executor.Worker;
import analysis.executor.WorkerProtocol;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.summary.SummaryStatus;

public class WorkerMainTest {

    private final Worker<HeapSet, BiAbductionSummary> worker = new Worker<>(new Checker<>("biabduction",
                                                                                        new BiAbductionDomain()),
                                                                            new EngineConfig());
    private final WorkerProtocol<BiAbductionSummary> protocol = new WorkerProtocol<>(BiAbductionSummary.CODEC);

    private WorkRequest<BiAbductionSummary> request(ProcedureDescriptor pd, Map<ProcedureId, BiAbductionSummary> summaries) {
        return new WorkRequest<>(new WorkItem(pd.getId(), 0, 0, false), pd,
                                 new CalleeSummaries<>(summaries, Collections.singleton(pd.getId())), null);
    }

    private BiAbductionSummary summarize(ProcedureDescriptor pd) {
        return worker.run(request(pd, Collections.<ProcedureId, BiAbductionSummary> emptyMap())).getPayload();
    }

    @Test
    public void testServeMatchesInProcessWorker() throws IOException {
        Map<ProcedureId, BiAbductionSummary> summaries = new LinkedHashMap<>();
        summaries.put(ExamplePrograms.ALLOC_AND_USE, summarize(ExamplePrograms.allocAndUse()));
        summaries.put(ExamplePrograms.MAYBE_NULL_DEREF, summarize(ExamplePrograms.maybeNullDeref()));
        WorkRequest<BiAbductionSummary> req = request(ExamplePrograms.callsBoth(), summaries);

        String input = protocol.encodeRequest(req).toString() + "\n\n" + "this is not a request\n";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        int served = WorkerMain.serve(new BufferedReader(new StringReader(input)), out, worker);
        assertEquals(2, served);

        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        WorkResult<BiAbductionSummary> remote = protocol.decodeResult(new JSONObject(lines[0]));
        WorkResult<BiAbductionSummary> local = worker.run(req);
        assertEquals(SummaryStatus.OK, remote.getStatus());
        assertEquals(local.getPayload(), remote.getPayload());
        assertEquals(local.getIssues(), remote.getIssues());

        WorkResult<BiAbductionSummary> bad = protocol.decodeResult(new JSONObject(lines[1]));
        assertEquals(SummaryStatus.FAILED_MALFORMED, bad.getStatus());
        assertTrue(bad.getMessage().startsWith("bad request"));
    }
}
