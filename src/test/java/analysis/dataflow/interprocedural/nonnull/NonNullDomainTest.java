package analysis.dataflow.interprocedural.nonnull;

import static analysis.ExamplePrograms.call;
import static analysis.ExamplePrograms.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Test;

import analysis.ExamplePrograms;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.FixpointSolver;
import analysis.dataflow.SolverResult;
import analysis.ir.AssignInstruction;
import analysis.ir.Instruction;
import analysis.ir.LoadInstruction;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import analysis.ir.PruneInstruction;
import analysis.ir.PruneInstruction.Comparison;
import analysis.ir.ReturnInstruction;

public class NonNullDomainTest {

    private static final ProcedureId NULL_RETURN = ProcedureId.of("null_return");
    private static final ProcedureId CALLER = ProcedureId.of("caller");

    private final FixpointSolver<NonNullState, NonNullAbsVal> solver = new FixpointSolver<>(new NonNullDomain());

    private SolverResult<NonNullAbsVal> solve(ProcedureDescriptor pd) {
        return solver.solve(pd, CalleeSummaries.<NonNullAbsVal> none(pd.getId()));
    }

    private static ProcedureDescriptor straightLine(ProcedureId id, Instruction... instrs) {
        return ProcedureDescriptor.builder(id).node(0, instrs).edge(0, 1).entry(0).exit(1).build();
    }

    @Test
    public void testMaybeNullDereference() {
        SolverResult<NonNullAbsVal> r = solve(ExamplePrograms.maybeNullDeref());
        assertEquals(1, r.getIssues().size());
        assertEquals(NonNullDomain.NULLABLE_DEREFERENCE, r.getIssues().get(0).getKind());
        assertEquals(3, r.getIssues().get(0).getLocation().getNode());
    }

    @Test
    public void testAllocationIsNonNull() {
        SolverResult<NonNullAbsVal> r = solve(ExamplePrograms.allocAndUse());
        assertTrue(r.getIssues().isEmpty());
        assertSame(NonNullAbsVal.NON_NULL, r.getSummary());
    }

    @Test
    public void testPruneRefinesNullness() {
        ProcedureDescriptor pd = straightLine(CALLER, new AssignInstruction("x", Operand.NULL),
                                              new PruneInstruction(v("x"), Comparison.NE, Operand.NULL),
                                              new LoadInstruction("y", "x", "f"));
        assertTrue(solve(pd).getIssues().isEmpty());
    }

    @Test
    public void testNullableSummaryFlowsToCaller() {
        ProcedureDescriptor callee = straightLine(NULL_RETURN, new AssignInstruction("x", Operand.NULL),
                                                  new ReturnInstruction(v("x")));
        NonNullAbsVal summary = solve(callee).getSummary();
        assertSame(NonNullAbsVal.MAY_BE_NULL, summary);

        ProcedureDescriptor caller = straightLine(CALLER, call("r", NULL_RETURN), new LoadInstruction("y", "r", "f"),
                                                  new LoadInstruction("z", "r", "g"));
        SolverResult<NonNullAbsVal> r = solver.solve(caller, new CalleeSummaries<>(Collections.singletonMap(NULL_RETURN,
                                                                                                            summary),
                                                                                   Collections.singleton(CALLER)));
        // after the first dereference r is known to be non-null
        assertEquals(1, r.getIssues().size());
        assertEquals(1, r.getIssues().get(0).getLocation().getIndex());
    }

    @Test
    public void testSummaryCodec() {
        NonNullDomain d = new NonNullDomain();
        assertSame(NonNullAbsVal.MAY_BE_NULL, d.codec().fromJSON(d.codec().toJSON(NonNullAbsVal.MAY_BE_NULL)));
    }
}
