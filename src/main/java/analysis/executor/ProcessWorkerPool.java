package analysis.executor;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.json.JSONException;
import org.json.JSONObject;

import util.Logger;

/**
 * Runs requests in separate worker JVMs (see {@link main.WorkerMain}), one request at a time per process. A worker that
 * exceeds the time budget is destroyed and replaced; a worker that dies (end of its output) is reported as crashed
 * and replaced. The worker's standard error is passed through.
 *
 * @param <S>
 *            summary payload type
 */
public final class ProcessWorkerPool<S> implements WorkerPool<S> {

    private final WorkerProtocol<S> protocol;
    private final List<String> command;
    private final long timeoutMillis;
    private final List<Slot> slots;
    private final Deque<WorkRequest<S>> waiting = new ArrayDeque<>();
    private final LinkedBlockingQueue<Message> messages = new LinkedBlockingQueue<>();
    private final Deque<WorkCompletion<S>> completed = new ArrayDeque<>();
    private int numRespawned = 0;

    /**
     * A line (or end of output) from a worker process
     */
    private static final class Message {
        final int slot;
        final int generation;
        /**
         * null at end of output
         */
        final String line;

        Message(int slot, int generation, String line) {
            this.slot = slot;
            this.generation = generation;
            this.line = line;
        }
    }

    /**
     * One worker process and the request it is working on
     */
    private final class Slot {
        final int index;
        /**
         * Incremented each time the process is replaced, so that output of a dead process is ignored
         */
        int generation = 0;
        Process process;
        BufferedWriter in;
        WorkRequest<S> current;
        long start;

        Slot(int index) {
            this.index = index;
        }

        void spawn() {
            generation++;
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectError(ProcessBuilder.Redirect.INHERIT);
            try {
                process = pb.start();
            }
            catch (IOException e) {
                throw new UncheckedIOException("Could not start worker process " + command, e);
            }
            in = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            final BufferedReader out = new BufferedReader(new InputStreamReader(process.getInputStream(),
                                                                                StandardCharsets.UTF_8));
            final int gen = generation;
            Thread reader = new Thread(new Runnable() {
                @Override
                public void run() {
                    try {
                        String line;
                        while ((line = out.readLine()) != null) {
                            messages.add(new Message(index, gen, line));
                        }
                    }
                    catch (IOException e) {
                        Logger.println(2, "Worker " + index + " output closed: " + e.getMessage());
                    }
                    messages.add(new Message(index, gen, null));
                }
            }, "worker-reader-" + index + "-" + gen);
            reader.setDaemon(true);
            reader.start();
        }

        void send(WorkRequest<S> req) {
            current = req;
            start = System.currentTimeMillis();
            try {
                in.write(protocol.encodeRequest(req).toString());
                in.newLine();
                in.flush();
            }
            catch (IOException e) {
                // the process died, its reader reports the end of output
                Logger.println(1, "Could not send " + req.getItem() + " to worker " + index + ": " + e.getMessage());
            }
        }

        void kill() {
            process.destroyForcibly();
            current = null;
        }

        long elapsed() {
            return System.currentTimeMillis() - start;
        }
    }

    /**
     * Start the worker processes
     *
     * @param protocol
     *            message codec
     * @param command
     *            command line starting one worker
     * @param numWorkers
     *            number of processes
     * @param timeoutMillis
     *            budget per request
     */
    public ProcessWorkerPool(WorkerProtocol<S> protocol, List<String> command, int numWorkers, long timeoutMillis) {
        this.protocol = protocol;
        this.command = new ArrayList<>(command);
        this.timeoutMillis = timeoutMillis;
        this.slots = new ArrayList<>(numWorkers);
        for (int i = 0; i < numWorkers; i++) {
            Slot s = new Slot(i);
            s.spawn();
            slots.add(s);
        }
    }

    /**
     * Command line running {@link main.WorkerMain} in a JVM like the current one
     *
     * @param workerArgs
     *            arguments for the worker
     * @return command
     */
    public static List<String> javaCommand(List<String> workerArgs) {
        return javaCommand("main.WorkerMain", workerArgs);
    }

    /**
     * Command line running the given main class in a JVM like the current one, with the same class path
     *
     * @param mainClass
     *            class whose main method serves requests
     * @param workerArgs
     *            arguments for the worker
     * @return command
     */
    public static List<String> javaCommand(String mainClass, List<String> workerArgs) {
        List<String> cmd = new ArrayList<>();
        cmd.add(System.getProperty("java.home") + "/bin/java");
        cmd.add("-ea");
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(mainClass);
        cmd.addAll(workerArgs);
        return cmd;
    }

    @Override
    public void submit(WorkRequest<S> request) {
        waiting.add(request);
        dispatch();
    }

    private void dispatch() {
        for (Slot s : slots) {
            if (waiting.isEmpty()) {
                return;
            }
            if (s.current == null) {
                s.send(waiting.poll());
            }
        }
    }

    @Override
    public WorkCompletion<S> poll(long maxWaitMillis) throws InterruptedException {
        long until = System.currentTimeMillis() + maxWaitMillis;
        while (completed.isEmpty()) {
            expireTimedOut();
            if (!completed.isEmpty()) {
                break;
            }
            long now = System.currentTimeMillis();
            if (now >= until) {
                return null;
            }
            long wait = until - now;
            for (Slot s : slots) {
                if (s.current != null) {
                    wait = Math.min(wait, Math.max(1, s.start + timeoutMillis - now));
                }
            }
            Message m = messages.poll(wait, TimeUnit.MILLISECONDS);
            if (m != null) {
                handle(m);
            }
        }
        dispatch();
        return completed.poll();
    }

    private void handle(Message m) {
        Slot s = slots.get(m.slot);
        if (m.generation != s.generation) {
            return;
        }
        if (m.line == null) {
            WorkRequest<S> req = s.current;
            Logger.println(1, "Worker " + s.index + " died" + (req == null ? "" : " while analyzing " + req.getItem()));
            if (req != null) {
                completed.add(WorkCompletion.crashed(req, "worker process exited", s.elapsed()));
            }
            s.kill();
            respawn(s);
            return;
        }
        if (s.current == null) {
            Logger.println(1, "Ignoring unexpected output from worker " + s.index + ": " + m.line);
            return;
        }
        WorkRequest<S> req = s.current;
        s.current = null;
        try {
            completed.add(WorkCompletion.finished(req, protocol.decodeResult(new JSONObject(m.line)), s.elapsed()));
        }
        catch (JSONException | IllegalArgumentException e) {
            completed.add(WorkCompletion.crashed(req, "unreadable result: " + e.getMessage(), s.elapsed()));
        }
    }

    private void expireTimedOut() {
        long now = System.currentTimeMillis();
        for (Slot s : slots) {
            if (s.current != null && now - s.start >= timeoutMillis) {
                Logger.println(1, "TIMEOUT " + s.current.getItem() + " after " + s.elapsed()
                        + "ms, restarting worker " + s.index);
                completed.add(WorkCompletion.timedOut(s.current, s.elapsed()));
                s.kill();
                respawn(s);
            }
        }
    }

    private void respawn(Slot s) {
        numRespawned++;
        s.spawn();
    }

    public int getNumRespawned() {
        return numRespawned;
    }

    @Override
    public int getNumPending() {
        int n = waiting.size() + completed.size();
        for (Slot s : slots) {
            if (s.current != null) {
                n++;
            }
        }
        return n;
    }

    @Override
    public void shutdown() {
        waiting.clear();
        for (Slot s : slots) {
            try {
                s.in.close();
            }
            catch (IOException e) {
                Logger.println(2, "Closing worker " + s.index + ": " + e.getMessage());
            }
            s.generation++;
            s.process.destroy();
        }
    }
}
