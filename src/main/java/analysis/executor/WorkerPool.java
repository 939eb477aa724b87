package analysis.executor;

/**
 * Runs work requests in isolation from the coordinator and from each other. A request that runs out of time or
 * kills its worker comes back as a failed {@link WorkCompletion}; it never affects other requests.
 *
 * @param <S>
 *            summary payload type
 */
public interface WorkerPool<S> {

    /**
     * Queue a request, it starts as soon as a worker is free
     *
     * @param request
     *            request
     */
    void submit(WorkRequest<S> request);

    /**
     * Wait for the next completed request, enforcing per-request timeouts while waiting
     *
     * @param maxWaitMillis
     *            how long to wait
     * @return next completion, or null if none arrived in time
     * @throws InterruptedException
     *             if the coordinator thread is interrupted
     */
    WorkCompletion<S> poll(long maxWaitMillis) throws InterruptedException;

    /**
     * Number of submitted requests that have not completed
     */
    int getNumPending();

    /**
     * Stop all workers, abandoning requests still running
     */
    void shutdown();
}
