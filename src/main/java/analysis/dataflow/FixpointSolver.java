package analysis.dataflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.OrderedPair;
import util.WorkQueue;
import analysis.ir.CFGNode;
import analysis.ir.CallInstruction;
import analysis.ir.Instruction;
import analysis.ir.Location;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;

/**
 * Forward worklist data-flow over the control flow graph of a single procedure. Calls are interpreted with callee
 * summaries so that the solver never looks at another procedure's code.
 * <p>
 * Termination: once a node has been visited <code>wideningThreshold</code> times its input is widened rather than
 * joined, and a node visited <code>maxNodeVisits</code> times is frozen. A frozen node marks the result as
 * convergence forced; a summary is extracted anyway.
 *
 * @param <D>
 *            data-flow fact
 * @param <S>
 *            summary payload
 */
public final class FixpointSolver<D, S> {

    public static final int DEFAULT_WIDENING_THRESHOLD = 3;
    public static final int DEFAULT_MAX_NODE_VISITS = 50;

    private final AbstractDomain<D, S> domain;
    private final int wideningThreshold;
    private final int maxNodeVisits;
    private int outputLevel = 0;

    public FixpointSolver(AbstractDomain<D, S> domain) {
        this(domain, DEFAULT_WIDENING_THRESHOLD, DEFAULT_MAX_NODE_VISITS);
    }

    public FixpointSolver(AbstractDomain<D, S> domain, int wideningThreshold, int maxNodeVisits) {
        assert wideningThreshold >= 1 && maxNodeVisits >= wideningThreshold;
        this.domain = domain;
        this.wideningThreshold = wideningThreshold;
        this.maxNodeVisits = maxNodeVisits;
    }

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    public AbstractDomain<D, S> getDomain() {
        return domain;
    }

    /**
     * Input, output and visit count for a node
     */
    private static final class NodeRecord<D> {
        D input;
        D output;
        int visits;
    }

    /**
     * Compute the summary of a procedure
     *
     * @param pd
     *            procedure to analyze
     * @param callees
     *            summaries of the procedure's callees
     * @return summary, issues and flags
     * @throws MalformedInstructionException
     *             if an instruction cannot be interpreted
     * @throws AnalysisTimeoutException
     *             if the analyzing thread is interrupted
     */
    public SolverResult<S> solve(ProcedureDescriptor pd, CalleeSummaries<S> callees) {
        Map<Integer, NodeRecord<D>> records = new LinkedHashMap<>();
        Map<OrderedPair<Location, String>, Issue> issues = new LinkedHashMap<>();
        boolean convergenceForced = false;
        boolean[] needsAnotherIteration = new boolean[1];
        int nodeVisits = 0;
        int instructions = 0;

        WorkQueue<Integer> q = new WorkQueue<>();
        q.add(pd.getEntry());
        while (!q.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AnalysisTimeoutException(pd.getId());
            }
            int n = q.poll();
            CFGNode node = pd.getNode(n);
            NodeRecord<D> rec = records.get(n);

            D in = n == pd.getEntry() ? domain.initialState(pd) : domain.bottom();
            for (Integer p : pd.getPreds(n)) {
                NodeRecord<D> pr = records.get(p);
                if (pr != null && pr.output != null) {
                    in = domain.join(in, pr.output);
                }
            }

            if (rec == null) {
                rec = new NodeRecord<>();
                records.put(n, rec);
            }
            else {
                if (domain.leq(in, rec.input)) {
                    continue;
                }
                if (rec.visits >= maxNodeVisits) {
                    if (outputLevel >= 2) {
                        System.err.println("FROZE N" + n + " in " + pd.getId() + " after " + rec.visits + " visits");
                    }
                    convergenceForced = true;
                    continue;
                }
                in = rec.visits < wideningThreshold ? domain.join(rec.input, in) : domain.widen(rec.input, in,
                                                                                                 rec.visits);
            }
            rec.input = in;
            rec.visits++;
            nodeVisits++;

            if (outputLevel >= 3) {
                System.err.println("FLOWING N" + n + " of " + pd.getId() + " visit " + rec.visits + "\n\tIN: " + in);
            }

            D d = in;
            List<Instruction> instrs = node.getInstructions();
            for (int i = 0; i < instrs.size(); i++) {
                Instruction ins = instrs.get(i);
                Location loc = new Location(pd.getId(), n, i, ins.getLine());
                try {
                    addIssues(issues, domain.report(d, ins, loc));
                    if (ins instanceof CallInstruction) {
                        d = interpretCall(d, (CallInstruction) ins, loc, callees, issues, needsAnotherIteration);
                    }
                    else {
                        d = domain.transfer(d, ins);
                    }
                }
                catch (MalformedInstructionException e) {
                    e.setLocation(loc);
                    throw e;
                }
                instructions++;
            }

            D out = rec.output == null ? d : domain.join(rec.output, d);
            if (rec.output == null || !domain.leq(out, rec.output)) {
                rec.output = out;
                if (outputLevel >= 3) {
                    System.err.println("\tOUT: " + out);
                }
                q.addAll(node.getSuccs());
            }
        }

        Set<D> exitStates = new LinkedHashSet<>();
        NodeRecord<D> exit = records.get(pd.getExit());
        if (exit != null && exit.output != null) {
            exitStates.add(exit.output);
        }
        S summary = domain.extractSummary(pd, exitStates);
        if (outputLevel >= 2) {
            System.err.println("SUMMARY " + pd.getId() + " after " + nodeVisits + " node visits: " + summary);
        }
        return new SolverResult<>(summary, new ArrayList<>(issues.values()), convergenceForced,
                                  needsAnotherIteration[0], nodeVisits, instructions);
    }

    /**
     * Record issues, keeping the first one of each kind at a location
     */
    private static void addIssues(Map<OrderedPair<Location, String>, Issue> issues, List<Issue> found) {
        for (Issue issue : found) {
            OrderedPair<Location, String> key = new OrderedPair<>(issue.getLocation(), issue.getKind());
            if (!issues.containsKey(key)) {
                issues.put(key, issue);
            }
        }
    }

    /**
     * Apply the summary of every candidate callee and join the results
     */
    private D interpretCall(D d, CallInstruction call, Location loc, CalleeSummaries<S> callees,
                            Map<OrderedPair<Location, String>, Issue> issues, boolean[] needsAnotherIteration) {
        D result = null;
        for (ProcedureId c : call.getCandidates()) {
            S s = callees.get(c);
            D r;
            if (s != null) {
                addIssues(issues, domain.reportCall(d, c, s, call, loc));
                r = domain.applySummary(d, s, call);
            }
            else if (callees.isSameScc(c)) {
                // recursive call not summarized yet, the SCC will be iterated again
                r = domain.bottom();
                needsAnotherIteration[0] = true;
            }
            else {
                r = domain.applySummary(d, domain.conservativeSummary(c, call.getArgs().size()), call);
            }
            result = result == null ? r : domain.join(result, r);
        }
        return result;
    }
}
