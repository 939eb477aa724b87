package analysis.dataflow.interprocedural;

import analysis.ir.ProcedureId;

/**
 * Request to (re)analyze one procedure
 */
public final class WorkItem {

    private final ProcedureId procedure;
    private final int sccIndex;
    /**
     * Number of earlier attempts that crashed
     */
    private final int retries;
    /**
     * Widen the new summary with the previous one, set for members of recursive SCCs that keep changing
     */
    private final boolean widenSummaries;

    public WorkItem(ProcedureId procedure, int sccIndex, int retries, boolean widenSummaries) {
        this.procedure = procedure;
        this.sccIndex = sccIndex;
        this.retries = retries;
        this.widenSummaries = widenSummaries;
    }

    public ProcedureId getProcedure() {
        return procedure;
    }

    public int getSccIndex() {
        return sccIndex;
    }

    public int getRetries() {
        return retries;
    }

    public boolean widenSummaries() {
        return widenSummaries;
    }

    /**
     * The same item for another attempt after a crash
     *
     * @return item with the retry count incremented
     */
    public WorkItem retry() {
        return new WorkItem(procedure, sccIndex, retries + 1, widenSummaries);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof WorkItem)) {
            return false;
        }
        WorkItem other = (WorkItem) obj;
        return procedure.equals(other.procedure) && sccIndex == other.sccIndex && retries == other.retries
                && widenSummaries == other.widenSummaries;
    }

    @Override
    public int hashCode() {
        return (procedure.hashCode() * 31 + retries) * 2 + (widenSummaries ? 1 : 0);
    }

    @Override
    public String toString() {
        return "WorkItem(" + procedure + ", SCC" + sccIndex + (retries > 0 ? ", retry " + retries : "")
                + (widenSummaries ? ", widen" : "") + ")";
    }
}
