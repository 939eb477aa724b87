package analysis.dataflow;

import static analysis.ExamplePrograms.call;
import static analysis.ExamplePrograms.i;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.Test;

import analysis.ir.AssignInstruction;
import analysis.ir.CallInstruction;
import analysis.ir.LoadInstruction;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.ReturnInstruction;
import analysis.ir.StoreInstruction;

public class FixpointSolverTest {

    private static final ProcedureId LOOP = ProcedureId.of("loop");
    private static final ProcedureId CALLER = ProcedureId.of("caller");
    private static final ProcedureId CALLEE = ProcedureId.of("callee");
    private static final ProcedureId OTHER_CALLEE = ProcedureId.of("other_callee");

    /**
     * <pre>
     * loop(p) { while (*) { p.f = 0; n += 1; } }
     * </pre>
     */
    private static ProcedureDescriptor loop() {
        return ProcedureDescriptor.builder(LOOP, "p")
                                  .node(0)
                                  .node(1)
                                  .node(2, new StoreInstruction("p", "f", i(0), 4),
                                        new AssignInstruction("n", i(1), 5))
                                  .node(3)
                                  .edge(0, 1)
                                  .edge(1, 2)
                                  .edge(2, 1)
                                  .edge(1, 3)
                                  .entry(0)
                                  .exit(3)
                                  .build();
    }

    private static ProcedureDescriptor caller(CallInstruction c) {
        return ProcedureDescriptor.builder(CALLER).node(0, c).edge(0, 1).entry(0).exit(1).build();
    }

    @Test
    public void testStraightLine() {
        ProcedureDescriptor pd = ProcedureDescriptor.builder(CALLER)
                                                    .node(0, new AssignInstruction("a", i(2)),
                                                          new AssignInstruction("b", i(3)),
                                                          new ReturnInstruction(Operand.var("b")))
                                                    .edge(0, 1)
                                                    .entry(0)
                                                    .exit(1)
                                                    .build();
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(pd, CalleeSummaries.<Long> none(CALLER));
        assertEquals(Long.valueOf(5), r.getSummary());
        assertEquals(2, r.getNodeVisits());
        assertEquals(3, r.getInstructions());
        assertFalse(r.isConvergenceForced());
    }

    @Test
    public void testWideningTerminatesWithUpperBound() {
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(loop(), CalleeSummaries.<Long> none(LOOP));
        assertEquals(Long.valueOf(CounterDomain.TOP), r.getSummary());
        assertFalse(r.isConvergenceForced());
        // the store inside the loop is visited many times but reported once
        assertEquals(1, r.getIssues().size());
        Issue issue = r.getIssues().get(0);
        assertEquals(CounterDomain.STORE, issue.getKind());
        assertEquals(2, issue.getLocation().getNode());
        assertEquals(4, issue.getLocation().getLine());
    }

    @Test
    public void testNodeVisitCapForcesConvergence() {
        FixpointSolver<Long, Long> solver = new FixpointSolver<>(new CounterDomain(false), 3, 5);
        SolverResult<Long> r = solver.solve(loop(), CalleeSummaries.<Long> none(LOOP));
        assertTrue(r.isConvergenceForced());
        assertTrue(r.getNodeVisits() <= 4 * 5);
        assertTrue(r.getSummary() >= 0);
    }

    @Test
    public void testMalformedInstructionHasLocation() {
        ProcedureDescriptor pd = ProcedureDescriptor.builder(CALLER, "p")
                                                    .node(0, new AssignInstruction("a", i(1), 8),
                                                          new LoadInstruction("x", "p", "f", 9))
                                                    .edge(0, 1)
                                                    .entry(0)
                                                    .exit(1)
                                                    .build();
        try {
            new FixpointSolver<>(new CounterDomain(true)).solve(pd, CalleeSummaries.<Long> none(CALLER));
            fail("load should be rejected");
        }
        catch (MalformedInstructionException e) {
            assertEquals(CALLER, e.getLocation().getProcedure());
            assertEquals(0, e.getLocation().getNode());
            assertEquals(1, e.getLocation().getIndex());
            assertEquals(9, e.getLocation().getLine());
        }
    }

    @Test
    public void testCalleeSummaryApplied() {
        Map<ProcedureId, Long> summaries = new HashMap<>();
        summaries.put(CALLEE, 5L);
        CalleeSummaries<Long> callees = new CalleeSummaries<>(summaries, Collections.singleton(CALLER));
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(caller(call("r", CALLEE)), callees);
        assertEquals(Long.valueOf(5), r.getSummary());
        assertFalse(r.needsAnotherIteration());
    }

    @Test
    public void testCandidatesAreJoined() {
        Map<ProcedureId, Long> summaries = new HashMap<>();
        summaries.put(CALLEE, 5L);
        summaries.put(OTHER_CALLEE, 7L);
        CalleeSummaries<Long> callees = new CalleeSummaries<>(summaries, Collections.singleton(CALLER));
        CallInstruction c = new CallInstruction("r", Arrays.asList(CALLEE, OTHER_CALLEE),
                                                Collections.<Operand> emptyList(), 3);
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(caller(c), callees);
        assertEquals(Long.valueOf(7), r.getSummary());
    }

    @Test
    public void testCalleeWithoutCodeIsConservative() {
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(caller(call("r", CALLEE)),
                                                                                   CalleeSummaries.<Long> none(CALLER));
        assertEquals(Long.valueOf(CounterDomain.TOP), r.getSummary());
        assertFalse(r.needsAnotherIteration());
    }

    @Test
    public void testUnsummarizedSccMember() {
        CalleeSummaries<Long> callees = new CalleeSummaries<>(Collections.<ProcedureId, Long> emptyMap(),
                                                              new HashSet<>(Arrays.asList(CALLER, CALLEE)));
        SolverResult<Long> r = new FixpointSolver<>(new CounterDomain(true)).solve(caller(call("r", CALLEE)), callees);
        assertTrue(r.needsAnotherIteration());
        assertEquals(Long.valueOf(Long.MIN_VALUE), r.getSummary());
    }

    @Test
    public void testInterruptedSolveTimesOut() {
        Thread.currentThread().interrupt();
        try {
            new FixpointSolver<>(new CounterDomain(true)).solve(loop(), CalleeSummaries.<Long> none(LOOP));
            fail("interrupted solve should stop");
        }
        catch (AnalysisTimeoutException e) {
            assertEquals(LOOP, e.getProcedure());
        }
        finally {
            Thread.interrupted();
        }
    }
}
