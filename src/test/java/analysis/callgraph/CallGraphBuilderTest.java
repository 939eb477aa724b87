package analysis.callgraph;

import static analysis.ExamplePrograms.LEAF;
import static analysis.ExamplePrograms.LIBRARY;
import static analysis.ExamplePrograms.MID;
import static analysis.ExamplePrograms.OTHER;
import static analysis.ExamplePrograms.OTHER_LEAF;
import static analysis.ExamplePrograms.REC_A;
import static analysis.ExamplePrograms.REC_B;
import static analysis.ExamplePrograms.TOP;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;

import analysis.ExamplePrograms;
import analysis.ir.AssignInstruction;
import analysis.ir.CallInstruction;
import analysis.ir.Operand;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;

public class CallGraphBuilderTest {

    private static int position(CallGraph cg, ProcedureId id) {
        return cg.getSccs().indexOf(cg.getScc(id));
    }

    @Test
    public void testBottomUpOrder() {
        CallGraph cg = new CallGraphBuilder().build(ExamplePrograms.chain(1, false));
        assertEquals(5, cg.getNumProcedures());
        assertEquals(5, cg.getSccs().size());
        assertTrue(position(cg, LEAF) < position(cg, MID));
        assertTrue(position(cg, MID) < position(cg, TOP));
        assertTrue(position(cg, OTHER_LEAF) < position(cg, OTHER));
        for (Scc scc : cg.getSccs()) {
            assertFalse(scc.isRecursive());
        }
        assertEquals(Collections.singleton(MID), cg.getCallers(LEAF));
        assertEquals(Collections.singleton(OTHER_LEAF), cg.getCallees(OTHER));
        assertEquals(Collections.singleton(LIBRARY), cg.getExternalCallees(OTHER));
        assertEquals(new HashSet<>(Arrays.asList(LEAF, MID, TOP)), cg.getTransitiveCallers(Collections.singleton(LEAF)));
    }

    @Test
    public void testMutualRecursion() {
        CallGraph cg = new CallGraphBuilder().build(ExamplePrograms.mutualRecursion());
        assertEquals(1, cg.getSccs().size());
        Scc scc = cg.getScc(REC_A);
        assertTrue(scc.isRecursive());
        assertEquals(2, scc.size());
        assertTrue(cg.inSameScc(REC_A, REC_B));
    }

    @Test
    public void testSelfRecursion() {
        ProcedureId self = ProcedureId.of("self");
        ProcedureDescriptor d = ProcedureDescriptor.builder(self, "x")
                                                  .node(0, new CallInstruction(null, self,
                                                                               Arrays.asList(Operand.var("x"))))
                                                  .edge(0, 1)
                                                  .entry(0)
                                                  .exit(1)
                                                  .build();
        CallGraph cg = new CallGraphBuilder().build(Collections.singletonList(d));
        assertTrue(cg.getScc(self).isRecursive());
        assertEquals(1, cg.getScc(self).size());
    }

    @Test
    public void testDynamicDispatchEdges() {
        ProcedureId caller = ProcedureId.of("caller");
        ProcedureId impl1 = ProcedureId.of("Impl1.run");
        ProcedureId impl2 = ProcedureId.of("Impl2.run");
        List<ProcedureDescriptor> procs = new ArrayList<>();
        procs.add(ProcedureDescriptor.builder(caller)
                                     .node(0, new CallInstruction(null, Arrays.asList(impl1, impl2),
                                                                  Collections.<Operand> emptyList(), 3))
                                     .edge(0, 1)
                                     .entry(0)
                                     .exit(1)
                                     .build());
        for (ProcedureId impl : Arrays.asList(impl1, impl2)) {
            procs.add(ProcedureDescriptor.builder(impl)
                                         .node(0, new AssignInstruction("x", Operand.NULL))
                                         .edge(0, 1)
                                         .entry(0)
                                         .exit(1)
                                         .build());
        }
        CallGraph cg = new CallGraphBuilder().build(procs);
        assertEquals(new HashSet<>(Arrays.asList(impl1, impl2)), cg.getCallees(caller));
        assertEquals(1, cg.getEdges().size());
        assertTrue(cg.getEdges().get(0).isDynamicDispatch());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateProcedure() {
        List<ProcedureDescriptor> procs = new ArrayList<>(ExamplePrograms.chain(1, false));
        procs.add(ExamplePrograms.chain(2, false).get(0));
        new CallGraphBuilder().build(procs);
    }
}
