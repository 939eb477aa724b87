package analysis.dataflow;

import analysis.ir.ProcedureId;

/**
 * The analysis of a procedure was stopped because it exceeded its time budget
 */
public class AnalysisTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 3904587416130650127L;

    private final ProcedureId procedure;

    public AnalysisTimeoutException(ProcedureId procedure, long budgetMillis) {
        super("Analysis of " + procedure + " exceeded " + budgetMillis + "ms");
        this.procedure = procedure;
    }

    /**
     * The analysis thread was interrupted, usually because the coordinator gave up on it
     *
     * @param procedure
     *            procedure being analyzed
     */
    public AnalysisTimeoutException(ProcedureId procedure) {
        super("Analysis of " + procedure + " was interrupted");
        this.procedure = procedure;
    }

    public ProcedureId getProcedure() {
        return procedure;
    }
}
