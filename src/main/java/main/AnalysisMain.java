package main;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONException;

import util.Logger;
import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import analysis.dataflow.Checker;
import analysis.dataflow.interprocedural.Coordinator;
import analysis.dataflow.interprocedural.EngineConfig;
import analysis.dataflow.interprocedural.EngineConfig.Isolation;
import analysis.dataflow.interprocedural.RunReport;
import analysis.executor.ProcessWorkerPool;
import analysis.executor.ThreadWorkerPool;
import analysis.executor.Worker;
import analysis.executor.WorkerPool;
import analysis.executor.WorkerProtocol;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.serialization.IRJson;
import analysis.summary.FileSummaryStore;
import analysis.summary.InMemorySummaryStore;
import analysis.summary.SummaryCache;
import analysis.summary.SummaryJson;
import analysis.summary.SummaryStore;

import com.beust.jcommander.ParameterException;

/**
 * Analyze the procedures in the given IR files and print the issues found, see usage (pass in "-h")
 */
public class AnalysisMain {

    /**
     * Exit status for unusable input or options
     */
    public static final int BAD_INPUT = 2;

    /**
     * Run the analysis and exit with the status of {@link RunReport#exitStatus()}
     *
     * @param args
     *            options and input files, see usage
     */
    public static void main(String[] args) {
        AnalysisOptions options;
        try {
            options = AnalysisOptions.getOptions(args);
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(AnalysisOptions.getUsage());
            System.exit(BAD_INPUT);
            return;
        }
        if (options.shouldPrintUsage()) {
            System.err.println(AnalysisOptions.getUsage());
            return;
        }
        System.exit(run(options));
    }

    /**
     * Run the analysis
     *
     * @param options
     *            parsed options
     * @return exit status
     */
    public static int run(AnalysisOptions options) {
        Logger.setOutputLevel(options.getOutputLevel());
        if (options.getInputs().isEmpty()) {
            System.err.println("No input files");
            return BAD_INPUT;
        }
        Checker<?, ?> checker;
        CallGraph cg;
        try {
            checker = StandardCheckers.registry(options.getBiAbductionConfig()).compose(options.getCheckers());
            List<ProcedureDescriptor> procs = new ArrayList<>();
            for (String f : options.getInputs()) {
                procs.addAll(IRJson.readFile(Paths.get(f), false));
            }
            for (String f : options.getModels()) {
                procs.addAll(IRJson.readFile(Paths.get(f), true));
            }
            CallGraphBuilder builder = new CallGraphBuilder();
            builder.setOutputLevel(options.getOutputLevel());
            cg = builder.build(procs);
        }
        catch (IOException | JSONException | IllegalArgumentException e) {
            System.err.println("Unusable input: " + e.getMessage());
            return BAD_INPUT;
        }

        RunReport report;
        try {
            report = analyze(cg, checker, options);
        }
        catch (IOException e) {
            System.err.println("Cannot open summary cache " + options.getCacheDir() + ": " + e.getMessage());
            return BAD_INPUT;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted", e);
        }

        try {
            writeIssues(report, options.getIssuesFile());
        }
        catch (IOException e) {
            System.err.println("Cannot write issues to " + options.getIssuesFile() + ": " + e.getMessage());
            return BAD_INPUT;
        }
        System.err.println(report);
        return report.exitStatus();
    }

    /**
     * Analyze every procedure of the call graph with the given checker
     *
     * @param cg
     *            call graph
     * @param checker
     *            checker to run
     * @param options
     *            options for the cache, the workers and the engine
     * @return report for the run
     * @throws IOException
     *             if the cache directory cannot be used
     * @throws InterruptedException
     *             if the thread is interrupted
     */
    public static <D, S> RunReport analyze(CallGraph cg, Checker<D, S> checker, AnalysisOptions options)
            throws IOException, InterruptedException {
        EngineConfig config = options.getEngineConfig();
        SummaryStore<S> store;
        if (options.getCacheDir() != null) {
            store = new FileSummaryStore<>(Paths.get(options.getCacheDir()), checker.getDomain().codec());
        }
        else {
            store = new InMemorySummaryStore<>();
        }
        SummaryCache<S> cache = new SummaryCache<>(cg, store);
        cache.setOutputLevel(options.getOutputLevel());

        WorkerPool<S> pool;
        if (config.getIsolation() == Isolation.PROCESS) {
            pool = new ProcessWorkerPool<>(new WorkerProtocol<>(checker.getDomain().codec()),
                                           ProcessWorkerPool.javaCommand(options.workerArgs()), config.getWorkers(),
                                           config.getTimeoutMillis());
        }
        else {
            pool = new ThreadWorkerPool<>(new Worker<>(checker, config), config.getWorkers(),
                                          config.getTimeoutMillis());
        }
        return new Coordinator<>(cg, checker, cache, pool, config).run();
    }

    private static void writeIssues(RunReport report, String file) throws IOException {
        String json = SummaryJson.issuesToJSON(report.getIssues()).toString(2);
        if (file == null) {
            Writer w = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            w.write(json);
            w.write("\n");
            w.flush();
            return;
        }
        Path p = Paths.get(file);
        try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) {
            w.write(json);
            w.write("\n");
        }
    }
}
