package main;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.json.JSONException;
import org.json.JSONObject;

import util.Logger;
import analysis.dataflow.Checker;
import analysis.executor.ProcessWorkerPool;
import analysis.executor.WorkRequest;
import analysis.executor.WorkResult;
import analysis.executor.Worker;
import analysis.executor.WorkerProtocol;

import com.beust.jcommander.ParameterException;

/**
 * Entry point of a worker process started by {@link ProcessWorkerPool}. Reads one request per line from standard
 * input and writes one result per line to standard output until standard input is closed. Log output goes to
 * standard error.
 */
public class WorkerMain {

    /**
     * Serve requests
     *
     * @param args
     *            the checker and solver options of {@link AnalysisOptions#workerArgs()}
     * @throws IOException
     *             if standard input cannot be read
     */
    public static void main(String[] args) throws IOException {
        AnalysisOptions options;
        try {
            options = AnalysisOptions.getOptions(args);
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        Logger.setOutputLevel(options.getOutputLevel());
        Checker<?, ?> checker = StandardCheckers.registry(options.getBiAbductionConfig())
                                                .compose(options.getCheckers());
        PrintStream out = new PrintStream(System.out, true, "UTF-8");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        serve(in, out, worker(checker, options));
    }

    private static <D, S> Worker<D, S> worker(Checker<D, S> checker, AnalysisOptions options) {
        return new Worker<>(checker, options.getEngineConfig());
    }

    /**
     * Answer requests until the end of the input
     *
     * @param in
     *            requests, one JSON object per line
     * @param out
     *            results, one JSON object per line
     * @param worker
     *            analyzes the requested procedures
     * @return number of requests served
     * @throws IOException
     *             if the input cannot be read
     */
    public static <D, S> int serve(BufferedReader in, PrintStream out, Worker<D, S> worker) throws IOException {
        WorkerProtocol<S> protocol = new WorkerProtocol<>(worker.getChecker().getDomain().codec());
        int served = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.trim().isEmpty()) {
                continue;
            }
            WorkResult<S> result;
            try {
                WorkRequest<S> req = protocol.decodeRequest(new JSONObject(line));
                Logger.println(2, "WORKER analyzing " + req.getItem());
                result = worker.run(req);
            }
            catch (JSONException e) {
                result = WorkResult.malformed("bad request: " + e.getMessage());
            }
            out.println(protocol.encodeResult(result).toString());
            out.flush();
            served++;
        }
        return served;
    }
}
