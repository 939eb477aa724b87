package analysis.executor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import analysis.dataflow.AnalysisTimeoutException;
import util.Logger;

/**
 * Runs each request on its own daemon thread, with at most <code>slots</code> threads running at a time. A request that
 * exceeds its time budget is reported as timed out and its thread is interrupted and abandoned: the slot is free
 * again right away, whether or not the thread ever notices the interrupt. An {@link Error} thrown while analyzing
 * (e.g. a {@link StackOverflowError}) is reported as a crash.
 *
 * @param <S>
 *            summary payload type
 */
public final class ThreadWorkerPool<S> implements WorkerPool<S> {

    private final Worker<?, S> worker;
    private final int slots;
    private final long timeoutMillis;

    private final Deque<WorkRequest<S>> waiting = new ArrayDeque<>();
    /**
     * Requests running on a thread, only touched by the coordinator thread
     */
    private final List<Running> running = new ArrayList<>();
    private final LinkedBlockingQueue<WorkCompletion<S>> completions = new LinkedBlockingQueue<>();
    private int numAbandoned = 0;
    private volatile boolean isShutdown = false;

    /**
     * A request on its thread
     */
    private final class Running implements Runnable {
        final WorkRequest<S> request;
        final long start;
        final long deadline;
        /**
         * Set by whoever reports the completion first: the thread when it finishes, the pool when it times out
         */
        final AtomicBoolean reported = new AtomicBoolean(false);
        Thread thread;

        Running(WorkRequest<S> request) {
            this.request = request;
            this.start = System.currentTimeMillis();
            this.deadline = start + timeoutMillis;
        }

        @Override
        public void run() {
            WorkCompletion<S> c;
            try {
                WorkResult<S> r = worker.run(request);
                c = WorkCompletion.finished(request, r, elapsed());
            }
            catch (AnalysisTimeoutException e) {
                // interrupted by the pool, which has already reported the timeout
                c = WorkCompletion.timedOut(request, elapsed());
            }
            catch (Throwable t) {
                Logger.println(1, "CRASHED " + request.getItem() + ": " + t);
                c = WorkCompletion.crashed(request, t.toString(), elapsed());
            }
            if (reported.compareAndSet(false, true)) {
                completions.add(c);
            }
        }

        long elapsed() {
            return System.currentTimeMillis() - start;
        }
    }

    public ThreadWorkerPool(Worker<?, S> worker, int slots, long timeoutMillis) {
        assert slots > 0 && timeoutMillis > 0;
        this.worker = worker;
        this.slots = slots;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public void submit(WorkRequest<S> request) {
        if (isShutdown) {
            throw new IllegalStateException("Pool is shut down");
        }
        waiting.add(request);
        startWaiting();
    }

    private void startWaiting() {
        while (running.size() < slots && !waiting.isEmpty()) {
            Running r = new Running(waiting.poll());
            Thread t = new Thread(r, "worker-" + r.request.getItem().getProcedure());
            t.setDaemon(true);
            r.thread = t;
            running.add(r);
            t.start();
        }
    }

    @Override
    public WorkCompletion<S> poll(long maxWaitMillis) throws InterruptedException {
        long until = System.currentTimeMillis() + maxWaitMillis;
        while (true) {
            WorkCompletion<S> c = completions.poll();
            if (c == null) {
                expireTimedOut();
                c = completions.poll();
            }
            if (c != null) {
                removeRunning(c.getRequest());
                startWaiting();
                return c;
            }
            long now = System.currentTimeMillis();
            if (now >= until) {
                return null;
            }
            long wait = until - now;
            for (Running r : running) {
                wait = Math.min(wait, Math.max(1, r.deadline - now));
            }
            c = completions.poll(wait, TimeUnit.MILLISECONDS);
            if (c != null) {
                removeRunning(c.getRequest());
                startWaiting();
                return c;
            }
        }
    }

    private void expireTimedOut() {
        long now = System.currentTimeMillis();
        for (Running r : running) {
            if (now >= r.deadline && r.reported.compareAndSet(false, true)) {
                Logger.println(1, "TIMEOUT " + r.request.getItem() + " after " + r.elapsed() + "ms, abandoning "
                        + r.thread.getName());
                r.thread.interrupt();
                numAbandoned++;
                completions.add(WorkCompletion.timedOut(r.request, r.elapsed()));
            }
        }
    }

    private void removeRunning(WorkRequest<S> request) {
        Iterator<Running> iter = running.iterator();
        while (iter.hasNext()) {
            if (iter.next().request == request) {
                iter.remove();
                return;
            }
        }
    }

    @Override
    public int getNumPending() {
        return waiting.size() + running.size();
    }

    /**
     * Threads that were given up on after a timeout (they may still be running)
     *
     * @return number of abandoned threads
     */
    public int getNumAbandoned() {
        return numAbandoned;
    }

    @Override
    public void shutdown() {
        isShutdown = true;
        waiting.clear();
        for (Running r : running) {
            r.thread.interrupt();
        }
        running.clear();
    }
}
