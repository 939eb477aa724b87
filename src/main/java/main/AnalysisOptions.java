package main;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import analysis.dataflow.interprocedural.EngineConfig;
import analysis.dataflow.interprocedural.EngineConfig.Isolation;
import analysis.dataflow.interprocedural.biabduction.BiAbductionConfig;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options shared by {@link AnalysisMain} and {@link WorkerMain}
 */
public final class AnalysisOptions {

    /**
     * Frontend output to analyze
     */
    @Parameter(description = "IR files (JSON) to analyze")
    private List<String> inputs = new ArrayList<>();

    /**
     * Flag for printing usage information
     */
    @Parameter(names = { "-h", "-help", "--help" }, help = true, description = "Print usage information")
    private boolean help = false;

    @Parameter(names = { "-models" }, description = "Comma separated model files, summaries of library procedures written in the IR format")
    private List<String> models = new ArrayList<>();

    @Parameter(names = { "-checkers", "-c" }, description = "Comma separated names of the checkers to run, see the list below")
    private List<String> checkers = new ArrayList<>(Arrays.asList("biabduction"));

    /**
     * Directory of the persistent summary cache, no persistence if null
     */
    @Parameter(names = { "-cache" }, description = "Directory of the persistent summary cache. If not set, summaries are kept in memory for the run only.")
    private String cacheDir;

    @Parameter(names = { "-issues" }, description = "File the issues are written to (JSON array). Standard output if not set.")
    private String issuesFile;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    @Parameter(names = { "-workers", "-j" }, description = "Number of procedures analyzed in parallel")
    private Integer workers = Runtime.getRuntime().availableProcessors();

    @Parameter(names = { "-isolation" }, validateWith = AnalysisOptions.IsolationValidator.class, description = "How workers are isolated from the coordinator: \"process\" (one worker JVM per slot) or \"thread\" (in-process, for tests)")
    private String isolation = "process";

    /**
     * Validate the requested isolation mode
     */
    public static class IsolationValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            for (Isolation i : Isolation.values()) {
                if (i.name().equalsIgnoreCase(value)) {
                    return;
                }
            }
            throw new ParameterException("Invalid isolation mode for " + name + ": " + value);
        }
    }

    @Parameter(names = { "-timeout" }, description = "Wall-clock budget for the analysis of one procedure, in milliseconds")
    private Long timeoutMillis = EngineConfig.DEFAULT_TIMEOUT_MILLIS;

    @Parameter(names = { "-retries" }, description = "Number of times a procedure whose worker crashed is analyzed again")
    private Integer maxRetries = EngineConfig.DEFAULT_MAX_RETRIES;

    @Parameter(names = { "-noTimeoutSubstitute" }, description = "If set, a procedure that timed out gets no conservative placeholder summary")
    private boolean noTimeoutSubstitute = false;

    @Parameter(names = { "-strict" }, description = "Fail on the first malformed instruction instead of using a conservative summary")
    private boolean strict = false;

    @Parameter(names = { "-wideningThreshold" }, description = "Number of visits to a CFG node before its input is widened")
    private Integer wideningThreshold = EngineConfig.DEFAULT_WIDENING_THRESHOLD;

    @Parameter(names = { "-maxNodeVisits" }, description = "Number of visits after which a CFG node is frozen")
    private Integer maxNodeVisits = EngineConfig.DEFAULT_MAX_NODE_VISITS;

    @Parameter(names = { "-maxSccIterations" }, description = "Analyses per member of a recursive component before convergence is forced")
    private Integer maxSccIterations = EngineConfig.DEFAULT_MAX_SCC_ITERATIONS;

    @Parameter(names = { "-maxAtoms" }, description = "Bi-abduction: spatial atoms per disjunct kept by widening")
    private Integer maxAtoms = BiAbductionConfig.DEFAULT_MAX_ATOMS;

    @Parameter(names = { "-maxDisjuncts" }, description = "Bi-abduction: disjuncts kept by widening")
    private Integer maxDisjuncts = BiAbductionConfig.DEFAULT_MAX_DISJUNCTS;

    @Parameter(names = { "-maxSpecs" }, description = "Bi-abduction: specs per procedure summary")
    private Integer maxSpecs = BiAbductionConfig.DEFAULT_MAX_SPECS;

    /**
     * Parse the command line
     *
     * @param args
     *            arguments
     * @return parsed options
     * @throws ParameterException
     *             if an option is unknown or has a bad value
     */
    public static AnalysisOptions getOptions(String[] args) {
        AnalysisOptions o = new AnalysisOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public static String getUsage() {
        StringBuilder sb = new StringBuilder();
        JCommander jc = new JCommander(new AnalysisOptions());
        jc.setProgramName("accrue-interproc");
        jc.getUsageFormatter().usage(sb);
        sb.append("\nAvailable checkers: ").append(StandardCheckers.NAMES).append("\n");
        return sb.toString();
    }

    public boolean shouldPrintUsage() {
        return help;
    }

    public List<String> getInputs() {
        return inputs;
    }

    public List<String> getModels() {
        return models;
    }

    public List<String> getCheckers() {
        return checkers;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public String getIssuesFile() {
        return issuesFile;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public Isolation getIsolation() {
        return Isolation.valueOf(isolation.toUpperCase());
    }

    /**
     * Engine settings given by these options
     *
     * @return new configuration
     */
    public EngineConfig getEngineConfig() {
        return new EngineConfig().setWorkers(workers)
                                 .setIsolation(getIsolation())
                                 .setTimeoutMillis(timeoutMillis)
                                 .setMaxRetries(maxRetries)
                                 .setSubstituteOnTimeout(!noTimeoutSubstitute)
                                 .setStrict(strict)
                                 .setWideningThreshold(wideningThreshold)
                                 .setMaxNodeVisits(maxNodeVisits)
                                 .setMaxSccIterations(maxSccIterations)
                                 .setOutputLevel(outputLevel);
    }

    public BiAbductionConfig getBiAbductionConfig() {
        return new BiAbductionConfig().setMaxAtoms(maxAtoms).setMaxDisjuncts(maxDisjuncts).setMaxSpecs(maxSpecs);
    }

    /**
     * Options a worker process needs to analyze procedures exactly as an in-process worker would
     *
     * @return arguments for {@link WorkerMain}
     */
    public List<String> workerArgs() {
        List<String> args = new ArrayList<>();
        args.add("-checkers");
        args.add(join(checkers));
        args.add("-output");
        args.add(String.valueOf(outputLevel));
        args.add("-wideningThreshold");
        args.add(String.valueOf(wideningThreshold));
        args.add("-maxNodeVisits");
        args.add(String.valueOf(maxNodeVisits));
        args.add("-maxAtoms");
        args.add(String.valueOf(maxAtoms));
        args.add("-maxDisjuncts");
        args.add(String.valueOf(maxDisjuncts));
        args.add("-maxSpecs");
        args.add(String.valueOf(maxSpecs));
        return args;
    }

    private static String join(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String n : names) {
            if (sb.length() > 0) {
                sb.append(",");
            }
            sb.append(n);
        }
        return sb.toString();
    }
}
