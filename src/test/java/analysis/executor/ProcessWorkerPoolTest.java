package analysis.executor;

import static analysis.ExamplePrograms.call;
import static analysis.ExamplePrograms.i;
import static analysis.ExamplePrograms.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.Checker;
import analysis.dataflow.interprocedural.Coordinator;
import analysis.dataflow.interprocedural.EngineConfig;
import analysis.dataflow.interprocedural.EngineConfig.Isolation;
import analysis.dataflow.interprocedural.RunReport;
import analysis.dataflow.interprocedural.WorkItem;
import analysis.ir.AssignInstruction;
import analysis.ir.Instruction;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.ReturnInstruction;
import analysis.summary.InMemorySummaryStore;
import analysis.summary.SummaryCache;
import analysis.summary.SummaryStatus;

public class ProcessWorkerPoolTest {

    private static final ProcedureId OK = ProcedureId.of("ok");
    private static final ProcedureId SPIN = ProcedureId.of("spin");
    private static final ProcedureId CRASH = ProcedureId.of("crash");
    private static final ProcedureId CALLER = ProcedureId.of("caller");

    /**
     * Budget per request, including the start of a worker JVM
     */
    private static final long TIMEOUT_MILLIS = 5000;

    private ProcessWorkerPool<Long> pool;

    @After
    public void shutdown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private static ProcessWorkerPool<Long> startPool(int workers) {
        Checker<Long, Long> checker = ScriptedWorkerMain.checker();
        List<String> cmd = ProcessWorkerPool.javaCommand(ScriptedWorkerMain.class.getName(),
                                                         Collections.<String> emptyList());
        return new ProcessWorkerPool<>(new WorkerProtocol<>(checker.getDomain().codec()), cmd, workers,
                                       TIMEOUT_MILLIS);
    }

    private static ProcedureDescriptor straightLine(ProcedureId id, Instruction... instrs) {
        return ProcedureDescriptor.builder(id).node(0, instrs).edge(0, 1).entry(0).exit(1).build();
    }

    private static WorkRequest<Long> request(ProcedureDescriptor pd) {
        return new WorkRequest<>(new WorkItem(pd.getId(), 0, 0, false), pd, CalleeSummaries.<Long> none(pd.getId()),
                                 null);
    }

    private WorkCompletion<Long> await() throws InterruptedException {
        long until = System.currentTimeMillis() + 4 * TIMEOUT_MILLIS;
        while (System.currentTimeMillis() < until) {
            WorkCompletion<Long> c = pool.poll(200);
            if (c != null) {
                return c;
            }
        }
        throw new AssertionError("no completion from the worker pool");
    }

    @Test
    public void testResultFromWorkerProcess() throws InterruptedException {
        pool = startPool(1);
        pool.submit(request(straightLine(OK, new AssignInstruction("x", i(2)))));
        WorkCompletion<Long> c = await();
        assertTrue(c.getMessage(), c.isSuccess());
        assertEquals(SummaryStatus.OK, c.getStatus());
        assertEquals(Long.valueOf(2), c.getResult().getPayload());
        assertEquals(0, pool.getNumPending());
        assertEquals(0, pool.getNumRespawned());
    }

    @Test
    public void testHangingWorkerIsReplaced() throws InterruptedException {
        pool = startPool(1);
        pool.submit(request(straightLine(SPIN, new AssignInstruction("spin", i(1)))));
        pool.submit(request(straightLine(OK, new AssignInstruction("x", i(2)))));

        WorkCompletion<Long> first = await();
        assertEquals(SPIN, first.getItem().getProcedure());
        assertEquals(SummaryStatus.TIMED_OUT, first.getStatus());
        assertTrue(first.getElapsedMillis() >= TIMEOUT_MILLIS);
        assertEquals(1, pool.getNumRespawned());

        // the queued request runs on the new worker
        WorkCompletion<Long> second = await();
        assertEquals(OK, second.getItem().getProcedure());
        assertTrue(second.getMessage(), second.isSuccess());
        assertEquals(Long.valueOf(2), second.getResult().getPayload());
    }

    @Test
    public void testCrashedWorkerIsReplaced() throws InterruptedException {
        pool = startPool(1);
        pool.submit(request(straightLine(CRASH, new AssignInstruction("crash", i(1)))));
        WorkCompletion<Long> c = await();
        assertEquals(CRASH, c.getItem().getProcedure());
        assertEquals(SummaryStatus.CRASHED, c.getStatus());
        assertFalse(c.isSuccess());
        assertEquals(1, pool.getNumRespawned());

        pool.submit(request(straightLine(OK, new AssignInstruction("x", i(3)))));
        WorkCompletion<Long> next = await();
        assertTrue(next.getMessage(), next.isSuccess());
        assertEquals(Long.valueOf(3), next.getResult().getPayload());
    }

    @Test
    public void testRunWithWorkerProcesses() throws InterruptedException {
        List<ProcedureDescriptor> procs = Arrays.asList(straightLine(SPIN, new AssignInstruction("spin", i(1))),
                                                        straightLine(OK, new AssignInstruction("x", i(2))),
                                                        straightLine(CALLER, call("r", OK),
                                                                     new ReturnInstruction(v("r"))));
        CallGraph cg = new CallGraphBuilder().build(procs);
        InMemorySummaryStore<Long> store = new InMemorySummaryStore<>();
        EngineConfig config = new EngineConfig().setWorkers(2).setTimeoutMillis(TIMEOUT_MILLIS);
        assertEquals(Isolation.PROCESS, config.getIsolation());
        pool = startPool(config.getWorkers());
        RunReport report = new Coordinator<>(cg, ScriptedWorkerMain.checker(), new SummaryCache<>(cg, store), pool,
                                             config).run();

        assertEquals(SummaryStatus.TIMED_OUT, report.getOutcome(SPIN).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(OK).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(CALLER).getStatus());
        assertNotNull(store.read(CALLER));
        assertEquals(Long.valueOf(2), store.read(CALLER).getSummary().getPayload());
        assertEquals(1, pool.getNumRespawned());
    }
}
