package analysis.executor;

import analysis.dataflow.CalleeSummaries;
import analysis.dataflow.interprocedural.WorkItem;
import analysis.ir.ProcedureDescriptor;

/**
 * Everything a worker needs to analyze one procedure, so that it never has to look at the cache or the call graph
 *
 * @param <S>
 *            summary payload type
 */
public final class WorkRequest<S> {

    private final WorkItem item;
    private final ProcedureDescriptor descriptor;
    private final CalleeSummaries<S> callees;
    /**
     * Previous summary of the procedure, only set when the item asks for widening
     */
    private final S previous;

    public WorkRequest(WorkItem item, ProcedureDescriptor descriptor, CalleeSummaries<S> callees, S previous) {
        assert item.getProcedure().equals(descriptor.getId());
        this.item = item;
        this.descriptor = descriptor;
        this.callees = callees;
        this.previous = previous;
    }

    public WorkItem getItem() {
        return item;
    }

    public ProcedureDescriptor getDescriptor() {
        return descriptor;
    }

    public CalleeSummaries<S> getCallees() {
        return callees;
    }

    public S getPrevious() {
        return previous;
    }

    /**
     * Same request for the next attempt after a crash
     */
    public WorkRequest<S> retry() {
        return new WorkRequest<>(item.retry(), descriptor, callees, previous);
    }

    @Override
    public String toString() {
        return "WorkRequest(" + item + ")";
    }
}
