package util;

/**
 * Console logging shared by the coordinator and worker threads. Messages are prefixed with the id of the thread that
 * logged them.
 */
public class Logger {

    /**
     * Global verbosity, messages with a level above this are dropped
     */
    private static volatile int outputLevel = 0;

    private Logger() {
        // static methods only
    }

    public static void setOutputLevel(int level) {
        outputLevel = level;
    }

    public static int getOutputLevel() {
        return outputLevel;
    }

    /**
     * Print the message
     *
     * @param s
     *            message
     */
    public static void println(String s) {
        System.err.println("[" + Thread.currentThread().getId() + "]" + s);
    }

    /**
     * Print the message if the global output level is at least <code>level</code>
     *
     * @param level
     *            level of the message (higher is more detailed)
     * @param s
     *            message
     */
    public static void println(int level, String s) {
        if (outputLevel >= level) {
            println(s);
        }
    }
}
