package util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

public class HashingTest {

    @Test
    public void testSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", Hashing.sha256(""));
        assertEquals(64, Hashing.sha256("A.foo()V").length());
        assertFalse(Hashing.sha256("a").equals(Hashing.sha256("b")));
    }
}
