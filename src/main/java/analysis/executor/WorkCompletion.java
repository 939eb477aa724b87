package analysis.executor;

import analysis.dataflow.interprocedural.WorkItem;
import analysis.summary.SummaryStatus;

/**
 * A work item that left the pool: either the worker's result, or a timeout or crash detected by the pool
 *
 * @param <S>
 *            summary payload type
 */
public final class WorkCompletion<S> {

    private final WorkRequest<S> request;
    /**
     * Result sent by the worker, null if the worker never finished
     */
    private final WorkResult<S> result;
    /**
     * TIMED_OUT or CRASHED when there is no result
     */
    private final SummaryStatus failure;
    private final String message;
    private final long elapsedMillis;

    private WorkCompletion(WorkRequest<S> request, WorkResult<S> result, SummaryStatus failure, String message,
                           long elapsedMillis) {
        this.request = request;
        this.result = result;
        this.failure = failure;
        this.message = message;
        this.elapsedMillis = elapsedMillis;
    }

    public static <S> WorkCompletion<S> finished(WorkRequest<S> request, WorkResult<S> result, long elapsedMillis) {
        return new WorkCompletion<>(request, result, null, result.getMessage(), elapsedMillis);
    }

    public static <S> WorkCompletion<S> timedOut(WorkRequest<S> request, long elapsedMillis) {
        return new WorkCompletion<>(request, null, SummaryStatus.TIMED_OUT, "timed out after " + elapsedMillis
                + "ms", elapsedMillis);
    }

    public static <S> WorkCompletion<S> crashed(WorkRequest<S> request, String message, long elapsedMillis) {
        return new WorkCompletion<>(request, null, SummaryStatus.CRASHED, message, elapsedMillis);
    }

    public WorkRequest<S> getRequest() {
        return request;
    }

    public WorkItem getItem() {
        return request.getItem();
    }

    public WorkResult<S> getResult() {
        return result;
    }

    /**
     * Status of the analysis, from the worker's result if there is one
     *
     * @return status
     */
    public SummaryStatus getStatus() {
        return result == null ? failure : result.getStatus();
    }

    /**
     * True if a summary was computed
     */
    public boolean isSuccess() {
        return !getStatus().isFailure();
    }

    public String getMessage() {
        return message;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return getItem() + " " + getStatus() + (message == null ? "" : " (" + message + ")") + " in " + elapsedMillis
                + "ms";
    }
}
