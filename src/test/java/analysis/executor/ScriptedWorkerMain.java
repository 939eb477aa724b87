package analysis.executor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import main.WorkerMain;
import analysis.dataflow.Checker;
import analysis.dataflow.CounterDomain;
import analysis.dataflow.interprocedural.EngineConfig;
import analysis.ir.AssignInstruction;
import analysis.ir.Instruction;

/**
 * Worker process for {@link ProcessWorkerPoolTest}: analyzes with {@link CounterDomain}, except that an assignment to
 * "spin" never finishes and an assignment to "crash" kills the JVM.
 */
public final class ScriptedWorkerMain {

    public static final int CRASH_STATUS = 3;

    private static volatile boolean spinning = true;

    private ScriptedWorkerMain() {
        // main only
    }

    static Checker<Long, Long> checker() {
        return new Checker<Long, Long>("scripted", new CounterDomain(true) {
            @Override
            public Long transfer(Long d, Instruction i) {
                if (i instanceof AssignInstruction) {
                    String target = ((AssignInstruction) i).getTarget();
                    if (target.equals("spin")) {
                        spin();
                    }
                    else if (target.equals("crash")) {
                        System.exit(CRASH_STATUS);
                    }
                }
                return super.transfer(d, i);
            }
        });
    }

    private static void spin() {
        while (spinning) {
            Thread.yield();
        }
    }

    public static void main(String[] args) throws IOException {
        PrintStream out = new PrintStream(System.out, true, "UTF-8");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        WorkerMain.serve(in, out, new Worker<>(checker(), new EngineConfig()));
    }
}
