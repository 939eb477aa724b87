package analysis.executor;

import analysis.dataflow.AbstractDomain;
import analysis.dataflow.Checker;
import analysis.dataflow.FixpointSolver;
import analysis.dataflow.MalformedInstructionException;
import analysis.dataflow.SolverResult;
import analysis.dataflow.interprocedural.EngineConfig;
import analysis.summary.SummaryStatus;
import util.Logger;

/**
 * Analyzes single procedures with the fixpoint solver. Stateless, so one instance can serve several threads.
 *
 * @param <D>
 *            data-flow fact
 * @param <S>
 *            summary payload
 */
public final class Worker<D, S> {

    private final Checker<D, S> checker;
    private final FixpointSolver<D, S> solver;

    public Worker(Checker<D, S> checker, EngineConfig config) {
        this.checker = checker;
        this.solver = new FixpointSolver<>(checker.getDomain(), config.getWideningThreshold(),
                                           config.getMaxNodeVisits());
        this.solver.setOutputLevel(config.getOutputLevel());
    }

    public Checker<D, S> getChecker() {
        return checker;
    }

    /**
     * Run the solver for the request
     *
     * @param request
     *            procedure and callee summaries
     * @return summary and issues, or a FAILED_MALFORMED result
     * @throws analysis.dataflow.AnalysisTimeoutException
     *             if the thread is interrupted
     */
    public WorkResult<S> run(WorkRequest<S> request) {
        AbstractDomain<D, S> domain = checker.getDomain();
        SolverResult<S> r;
        try {
            r = solver.solve(request.getDescriptor(), request.getCallees());
        }
        catch (MalformedInstructionException e) {
            Logger.println(1, "MALFORMED " + request.getItem().getProcedure() + ": " + e.getMessage());
            return WorkResult.malformed(e.getMessage());
        }
        S payload = r.getSummary();
        if (request.getItem().widenSummaries() && request.getPrevious() != null) {
            payload = domain.widenSummary(request.getPrevious(), payload);
        }
        SummaryStatus status = r.isConvergenceForced() ? SummaryStatus.CONVERGENCE_FORCED : SummaryStatus.OK;
        return new WorkResult<>(status, payload, r.getIssues(), r.needsAnotherIteration(), r.getNodeVisits(),
                                r.getInstructions(), null);
    }
}
