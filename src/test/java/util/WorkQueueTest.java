package util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class WorkQueueTest {

    @Test
    public void testFifoWithoutDuplicates() {
        WorkQueue<String> q = new WorkQueue<>(Arrays.asList("a", "b"));
        assertTrue(q.add("c"));
        assertFalse(q.add("a"));
        assertEquals(3, q.size());
        assertEquals("a", q.poll());
        // may be added again once polled
        assertTrue(q.add("a"));
        assertEquals(Arrays.asList("b", "c", "a"), q.toList());
    }

    @Test
    public void testRemove() {
        WorkQueue<Integer> q = new WorkQueue<>(Arrays.asList(1, 2, 3));
        assertTrue(q.remove(2));
        assertFalse(q.remove(2));
        assertFalse(q.contains(2));
        assertEquals(Integer.valueOf(1), q.poll());
        assertEquals(Integer.valueOf(3), q.poll());
        assertTrue(q.isEmpty());
        assertNull(q.poll());
    }
}
