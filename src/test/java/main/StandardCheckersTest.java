package main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import analysis.ExamplePrograms;
import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.Checker;
import analysis.dataflow.CheckerRegistry;
import analysis.dataflow.FixpointSolver;
import analysis.dataflow.Issue;
import analysis.dataflow.ProductDomain;
import analysis.dataflow.interprocedural.biabduction.BiAbductionConfig;
import analysis.dataflow.interprocedural.biabduction.BiAbductionDomain;
import analysis.dataflow.interprocedural.nonnull.NonNullDomain;
import analysis.ir.ProcedureDescriptor;

public class StandardCheckersTest {

    private static <D, S> Set<String> issueKinds(Checker<D, S> checker, ProcedureDescriptor pd) {
        Set<String> kinds = new HashSet<>();
        for (Issue i : new FixpointSolver<>(checker.getDomain()).solve(pd, CalleeSummaries.<S> none(pd.getId()))
                                                               .getIssues()) {
            kinds.add(i.getKind());
        }
        return kinds;
    }

    @Test
    public void testRegistry() {
        CheckerRegistry r = StandardCheckers.registry(new BiAbductionConfig());
        assertEquals(StandardCheckers.NAMES, r.getNames());
        assertTrue(r.create(StandardCheckers.BIABDUCTION).getDomain() instanceof BiAbductionDomain);
        assertTrue(r.create(StandardCheckers.NONNULL).getDomain() instanceof NonNullDomain);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownChecker() {
        StandardCheckers.registry(new BiAbductionConfig()).create("taint");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateRegistration() {
        CheckerRegistry r = StandardCheckers.registry(new BiAbductionConfig());
        r.register(StandardCheckers.NONNULL, new CheckerRegistry.CheckerFactory() {
            @Override
            public Checker<?, ?> create() {
                return new Checker<>(StandardCheckers.NONNULL, new NonNullDomain());
            }
        });
    }

    @Test
    public void testSingleCheckerIsNotWrapped() {
        Checker<?, ?> c = StandardCheckers.registry(new BiAbductionConfig())
                                          .compose(Arrays.asList(StandardCheckers.NONNULL));
        assertEquals(StandardCheckers.NONNULL, c.getName());
        assertTrue(c.getDomain() instanceof NonNullDomain);
    }

    @Test
    public void testProductReportsBothKinds() {
        Checker<?, ?> c = StandardCheckers.registry(new BiAbductionConfig()).compose(StandardCheckers.NAMES);
        assertEquals("biabduction+nonnull", c.getName());
        assertTrue(c.getDomain() instanceof ProductDomain);
        Set<String> kinds = issueKinds(c, ExamplePrograms.maybeNullDeref());
        assertEquals(new HashSet<>(Arrays.asList(BiAbductionDomain.NULL_DEREFERENCE,
                                                 NonNullDomain.NULLABLE_DEREFERENCE)), kinds);
        assertTrue(issueKinds(c, ExamplePrograms.allocAndUse()).isEmpty());
    }
}
