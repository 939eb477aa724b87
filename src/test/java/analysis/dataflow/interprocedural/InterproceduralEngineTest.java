package analysis.dataflow.interprocedural;

import static analysis.ExamplePrograms.ALLOC_AND_USE;
import static analysis.ExamplePrograms.DEREF_LINE;
import static analysis.ExamplePrograms.LEAF;
import static analysis.ExamplePrograms.LIST_LENGTH;
import static analysis.ExamplePrograms.MAYBE_NULL_DEREF;
import static analysis.ExamplePrograms.MID;
import static analysis.ExamplePrograms.OTHER;
import static analysis.ExamplePrograms.OTHER_LEAF;
import static analysis.ExamplePrograms.REC_A;
import static analysis.ExamplePrograms.REC_B;
import static analysis.ExamplePrograms.TOP;
import static analysis.ExamplePrograms.call;
import static analysis.ExamplePrograms.i;
import static analysis.ExamplePrograms.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import analysis.ExamplePrograms;
import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.Checker;
import analysis.dataflow.CounterDomain;
import analysis.dataflow.FixpointSolver;
import analysis.dataflow.Issue;
import analysis.dataflow.SolverResult;
import analysis.dataflow.interprocedural.biabduction.BiAbductionDomain;
import analysis.dataflow.interprocedural.biabduction.BiAbductionSummary;
import analysis.dataflow.interprocedural.biabduction.HeapAtom;
import analysis.dataflow.interprocedural.biabduction.HeapSet;
import analysis.dataflow.interprocedural.biabduction.ListSegment;
import analysis.dataflow.interprocedural.biabduction.Spec;
import analysis.dataflow.interprocedural.biabduction.Term;
import analysis.executor.ThreadWorkerPool;
import analysis.executor.Worker;
import analysis.ir.AssignInstruction;
import analysis.ir.Instruction;
import analysis.ir.LoadInstruction;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.ReturnInstruction;
import analysis.summary.FileSummaryStore;
import analysis.summary.InMemorySummaryStore;
import analysis.summary.SummaryCache;
import analysis.summary.SummaryStatus;
import analysis.summary.SummaryStore;

public class InterproceduralEngineTest {

    private static final ProcedureId HANG = ProcedureId.of("hang");
    private static final ProcedureId HANG_CALLER = ProcedureId.of("hang_caller");
    private static final ProcedureId SIBLING = ProcedureId.of("sibling");

    /**
     * While set, the domain in {@link #hangingChecker()} spins on assignments to "spin"
     */
    private static volatile boolean hang = false;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @After
    public void stopSpinning() {
        hang = false;
    }

    private static Checker<HeapSet, BiAbductionSummary> biabduction() {
        return new Checker<>("biabduction", new BiAbductionDomain());
    }

    private static <D, S> RunReport run(Checker<D, S> checker, List<ProcedureDescriptor> procs,
                                        SummaryStore<S> store, EngineConfig config) throws InterruptedException {
        CallGraph cg = new CallGraphBuilder().build(procs);
        SummaryCache<S> cache = new SummaryCache<>(cg, store);
        ThreadWorkerPool<S> pool = new ThreadWorkerPool<>(new Worker<>(checker, config), config.getWorkers(),
                                                          config.getTimeoutMillis());
        return new Coordinator<>(cg, checker, cache, pool, config).run();
    }

    private static RunReport run(List<ProcedureDescriptor> procs, SummaryStore<BiAbductionSummary> store)
            throws InterruptedException {
        return run(biabduction(), procs, store, new EngineConfig());
    }

    private static List<ProcedureId> analyzed(RunReport report) {
        List<ProcedureId> l = new ArrayList<>();
        for (ProcedureOutcome o : report.getOutcomes().values()) {
            if (!o.isFromCache()) {
                l.add(o.getProcedure());
            }
        }
        return l;
    }

    private static BiAbductionSummary summary(InMemorySummaryStore<BiAbductionSummary> store, ProcedureId id) {
        return store.read(id).getSummary().getPayload();
    }

    @Test
    public void testNullDereferenceFoundCompositionally() throws InterruptedException {
        InMemorySummaryStore<BiAbductionSummary> store = new InMemorySummaryStore<>();
        RunReport report = run(ExamplePrograms.nullExample(), store);

        assertEquals(0, report.exitStatus());
        assertEquals(3, report.getNumAnalyzed());
        for (ProcedureOutcome o : report.getOutcomes().values()) {
            assertEquals(SummaryStatus.OK, o.getStatus());
        }
        assertTrue(report.getOutcome(ALLOC_AND_USE).getIssues().isEmpty());
        assertEquals(1, report.getIssues().size());
        Issue issue = report.getIssues().get(0);
        assertEquals(BiAbductionDomain.NULL_DEREFERENCE, issue.getKind());
        assertEquals(MAYBE_NULL_DEREF, issue.getProcedure());
        assertEquals(3, issue.getLocation().getNode());
        assertEquals(0, issue.getLocation().getIndex());
        assertEquals(DEREF_LINE, issue.getLocation().getLine());

        BiAbductionSummary alloc = summary(store, ALLOC_AND_USE);
        assertEquals(1, alloc.getSpecs().size());
        assertEquals(Term.intConst(1), alloc.getSpecs().first().getReturn());
    }

    @Test
    public void testResultIndependentOfOrderAndWorkers() throws InterruptedException {
        RunReport sequential = run(ExamplePrograms.nullExample(), new InMemorySummaryStore<BiAbductionSummary>());

        List<ProcedureDescriptor> reversed = new ArrayList<>(ExamplePrograms.nullExample());
        Collections.reverse(reversed);
        RunReport parallel = run(biabduction(), reversed, new InMemorySummaryStore<BiAbductionSummary>(),
                                 new EngineConfig().setWorkers(4));
        assertEquals(sequential.getIssues(), parallel.getIssues());
    }

    @Test
    public void testSecondRunIsAllCacheHits() throws IOException, InterruptedException {
        Path dir = tmp.newFolder("cache").toPath();
        RunReport first = run(ExamplePrograms.nullExample(),
                              new FileSummaryStore<>(dir, BiAbductionSummary.CODEC));
        FileSummaryStore<BiAbductionSummary> store = new FileSummaryStore<>(dir, BiAbductionSummary.CODEC);
        String hash = store.read(MAYBE_NULL_DEREF).getSummary().getHash();

        RunReport second = run(ExamplePrograms.nullExample(), new FileSummaryStore<>(dir, BiAbductionSummary.CODEC));
        assertEquals(0, second.getWorkItems());
        assertEquals(3, second.getNumCacheHits());
        assertEquals(first.getIssues(), second.getIssues());
        assertEquals(hash, store.read(MAYBE_NULL_DEREF).getSummary().getHash());
    }

    @Test
    public void testChangedLeafReanalyzesCallers() throws InterruptedException {
        InMemorySummaryStore<BiAbductionSummary> store = new InMemorySummaryStore<>();
        RunReport first = run(ExamplePrograms.chain(1, false), store);
        assertEquals(5, first.getNumAnalyzed());

        RunReport second = run(ExamplePrograms.chain(2, false), store);
        assertEquals(Arrays.asList(LEAF, MID, TOP), analyzed(second));
        assertTrue(second.getOutcome(OTHER).isFromCache());
        assertTrue(second.getOutcome(OTHER_LEAF).isFromCache());
        assertEquals(Term.intConst(2), summary(store, MID).getSpecs().first().getReturn());
    }

    @Test
    public void testUnchangedSummaryStopsPropagation() throws InterruptedException {
        InMemorySummaryStore<BiAbductionSummary> store = new InMemorySummaryStore<>();
        run(ExamplePrograms.chain(1, false), store);
        String leafHash = store.read(LEAF).getSummary().getHash();

        // different code, same behavior
        RunReport second = run(ExamplePrograms.chain(1, true), store);
        assertEquals(Collections.singletonList(LEAF), analyzed(second));
        assertEquals(leafHash, store.read(LEAF).getSummary().getHash());
        assertEquals(4, second.getNumCacheHits());
    }

    @Test
    public void testMutualRecursionConverges() throws InterruptedException {
        InMemorySummaryStore<BiAbductionSummary> store = new InMemorySummaryStore<>();
        RunReport report = run(ExamplePrograms.mutualRecursion(), store);
        assertEquals(0, report.exitStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(REC_A).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(REC_B).getStatus());
        assertTrue(report.getIssues().isEmpty());

        assertEquals(2, summary(store, REC_A).getSpecs().size());
        BiAbductionSummary b = summary(store, REC_B);
        assertEquals(1, b.getSpecs().size());
        assertEquals(Term.intConst(0), b.getSpecs().first().getReturn());

        // at the fixpoint, analyzing either member against the stored summaries yields nothing new
        Map<ProcedureId, BiAbductionSummary> stored = new HashMap<>();
        stored.put(REC_A, summary(store, REC_A));
        stored.put(REC_B, b);
        Set<ProcedureId> scc = new HashSet<>(Arrays.asList(REC_A, REC_B));
        FixpointSolver<HeapSet, BiAbductionSummary> solver = new FixpointSolver<>(new BiAbductionDomain());
        for (ProcedureDescriptor pd : ExamplePrograms.mutualRecursion()) {
            SolverResult<BiAbductionSummary> r = solver.solve(pd, new CalleeSummaries<>(stored, scc));
            assertFalse(r.needsAnotherIteration());
            assertTrue(r.getIssues().isEmpty());
            assertTrue(pd.getId() + ": " + r.getSummary(),
                       stored.get(pd.getId()).getSpecs().containsAll(r.getSummary().getSpecs()));
        }
    }

    private static final ProcedureId PING = ProcedureId.of("ping");
    private static final ProcedureId PONG = ProcedureId.of("pong");

    /**
     * <pre>
     * ping() { if (*) a = 1; else pong(); }
     * pong() { b = 1; ping(); }
     * </pre>
     *
     * Each pass over the SCC raises both counters by one.
     */
    private static List<ProcedureDescriptor> pingPong() {
        ProcedureDescriptor ping = ProcedureDescriptor.builder(PING)
                                                      .node(0)
                                                      .node(1, new AssignInstruction("a", i(1)))
                                                      .node(2, call("r", PONG))
                                                      .node(3)
                                                      .edge(0, 1)
                                                      .edge(0, 2)
                                                      .edge(1, 3)
                                                      .edge(2, 3)
                                                      .entry(0)
                                                      .exit(3)
                                                      .build();
        return Arrays.asList(ping, straightLine(PONG, new AssignInstruction("b", i(1)), call("r", PING)));
    }

    @Test
    public void testIterationCapForcesConvergence() throws InterruptedException {
        Checker<Long, Long> growing = new Checker<Long, Long>("growing", new CounterDomain(false) {
            @Override
            public Long widenSummary(Long previous, Long current) {
                return current;
            }
        });
        InMemorySummaryStore<Long> store = new InMemorySummaryStore<>();
        RunReport report = run(growing, pingPong(), store, new EngineConfig().setMaxSccIterations(2));
        assertEquals(4, report.getWorkItems());
        assertEquals(SummaryStatus.CONVERGENCE_FORCED, report.getOutcome(PING).getStatus());
        assertEquals(SummaryStatus.CONVERGENCE_FORCED, report.getOutcome(PONG).getStatus());
        assertEquals(SummaryStatus.CONVERGENCE_FORCED, store.read(PING).getSummary().getStatus());
        assertTrue(store.read(PONG).getSummary().getPayload() >= 2);
    }

    @Test
    public void testListTraversalTerminatesWithSegment() throws InterruptedException {
        InMemorySummaryStore<BiAbductionSummary> store = new InMemorySummaryStore<>();
        RunReport report = run(Collections.singletonList(ExamplePrograms.listLength()), store);
        assertFalse(report.getOutcome(LIST_LENGTH).getStatus().isFailure());
        assertTrue(report.getIssues().isEmpty());

        boolean segment = false;
        for (Spec s : summary(store, LIST_LENGTH).getSpecs()) {
            for (HeapAtom a : s.getPre()) {
                segment |= a instanceof ListSegment;
            }
        }
        assertTrue("expected a list segment in some precondition", segment);
    }

    private static Checker<Long, Long> hangingChecker() {
        return new Checker<Long, Long>("hanging", new CounterDomain(true) {
            @Override
            public Long transfer(Long d, Instruction i) {
                if (i instanceof AssignInstruction) {
                    String target = ((AssignInstruction) i).getTarget();
                    if (target.equals("spin")) {
                        while (hang && !Thread.currentThread().isInterrupted()) {
                            Thread.yield();
                        }
                    }
                    else if (target.equals("crash")) {
                        throw new IllegalStateException("worker crashed");
                    }
                }
                return super.transfer(d, i);
            }
        });
    }

    private static ProcedureDescriptor straightLine(ProcedureId id, Instruction... instrs) {
        return ProcedureDescriptor.builder(id).node(0, instrs).edge(0, 1).entry(0).exit(1).build();
    }

    @Test
    public void testTimeoutIsIsolated() throws InterruptedException {
        hang = true;
        List<ProcedureDescriptor> procs = Arrays.asList(straightLine(HANG, new AssignInstruction("spin", i(1)),
                                                                     new ReturnInstruction(i(0))),
                                                        straightLine(HANG_CALLER, call("r", HANG),
                                                                     new ReturnInstruction(v("r"))),
                                                        straightLine(SIBLING, new AssignInstruction("x", i(2))));
        InMemorySummaryStore<Long> store = new InMemorySummaryStore<>();
        EngineConfig config = new EngineConfig().setWorkers(2).setTimeoutMillis(300);
        RunReport report = run(hangingChecker(), procs, store, config);

        assertEquals(SummaryStatus.TIMED_OUT, report.getOutcome(HANG).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(HANG_CALLER).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(SIBLING).getStatus());
        assertEquals(1, report.exitStatus());
        // the placeholder is used by the caller but never stored
        assertNull(store.read(HANG));
        assertEquals(Long.valueOf(CounterDomain.TOP), store.read(HANG_CALLER).getSummary().getPayload());
        assertEquals(Long.valueOf(2), store.read(SIBLING).getSummary().getPayload());
    }

    @Test
    public void testTimedOutMemberOfRecursiveSccIsNotBottom() throws InterruptedException {
        hang = true;
        ProcedureId spinner = ProcedureId.of("spinner");
        ProcedureId user = ProcedureId.of("user");
        List<ProcedureDescriptor> procs = Arrays.asList(straightLine(spinner, new AssignInstruction("spin", i(1)),
                                                                     call("r", user), new ReturnInstruction(v("r"))),
                                                        straightLine(user, call("r", spinner),
                                                                     new ReturnInstruction(v("r"))));
        InMemorySummaryStore<Long> store = new InMemorySummaryStore<>();
        EngineConfig config = new EngineConfig().setTimeoutMillis(300).setSubstituteOnTimeout(false);
        RunReport report = run(hangingChecker(), procs, store, config);
        assertEquals(SummaryStatus.TIMED_OUT, report.getOutcome(spinner).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(user).getStatus());
        assertNull(store.read(spinner));
        // the caller assumed nothing about the spinner instead of assuming it never returns
        assertEquals(Long.valueOf(CounterDomain.TOP), store.read(user).getSummary().getPayload());
    }

    @Test
    public void testCrashAndMalformedGetPlaceholders() throws InterruptedException {
        ProcedureId crash = ProcedureId.of("crash");
        ProcedureId malformed = ProcedureId.of("malformed");
        List<ProcedureDescriptor> procs = Arrays.asList(straightLine(crash, new AssignInstruction("crash", i(1))),
                                                        straightLine(malformed, new LoadInstruction("x", "p", "f")),
                                                        straightLine(SIBLING, new AssignInstruction("x", i(2))));
        RunReport report = run(hangingChecker(), procs, new InMemorySummaryStore<Long>(), new EngineConfig());
        assertEquals(SummaryStatus.CRASHED, report.getOutcome(crash).getStatus());
        assertEquals(SummaryStatus.FAILED_MALFORMED, report.getOutcome(malformed).getStatus());
        assertEquals(SummaryStatus.OK, report.getOutcome(SIBLING).getStatus());
        assertEquals(2, report.getNumFailed());
        assertEquals(1, report.exitStatus());
    }

    @Test
    public void testStrictModeRejectsMalformed() throws InterruptedException {
        List<ProcedureDescriptor> procs = Collections.singletonList(straightLine(ProcedureId.of("malformed"),
                                                                                 new LoadInstruction("x", "p", "f")));
        try {
            run(hangingChecker(), procs, new InMemorySummaryStore<Long>(), new EngineConfig().setStrict(true));
        }
        catch (AssertionError e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("Malformed instruction in malformed"));
            return;
        }
        fail("strict run should stop");
    }
}
