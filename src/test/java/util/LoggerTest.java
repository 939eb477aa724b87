package util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LoggerTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private PrintStream err;

    @Before
    public void captureErr() throws Exception {
        err = System.err;
        System.setErr(new PrintStream(bytes, true, "UTF-8"));
    }

    @After
    public void restoreErr() {
        System.setErr(err);
        Logger.setOutputLevel(0);
    }

    private String captured() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testMessagesAboveLevelAreDropped() {
        Logger.setOutputLevel(1);
        Logger.println(1, "shown");
        Logger.println(2, "hidden");
        String out = captured();
        assertTrue(out, out.contains("shown"));
        assertEquals(out, -1, out.indexOf("hidden"));
    }

    @Test
    public void testThreadIdPrefix() {
        Logger.println("message");
        assertEquals("[" + Thread.currentThread().getId() + "]message", captured().trim());
    }
}
