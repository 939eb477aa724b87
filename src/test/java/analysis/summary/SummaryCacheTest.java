package analysis.summary;

import static analysis.ExamplePrograms.LEAF;
import static analysis.ExamplePrograms.LIBRARY;
import static analysis.ExamplePrograms.MID;
import static analysis.ExamplePrograms.OTHER;
import static analysis.ExamplePrograms.OTHER_LEAF;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import analysis.ExamplePrograms;
import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import analysis.dataflow.Issue;
import analysis.ir.Location;
import analysis.ir.ProcedureId;

public class SummaryCacheTest {

    static final SummaryCodec<String> STRINGS = new SummaryCodec<String>() {
        @Override
        public Object toJSON(String payload) {
            return payload;
        }

        @Override
        public String fromJSON(Object json) {
            return (String) json;
        }
    };

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static CallGraph chain(long leafValue) {
        return new CallGraphBuilder().build(ExamplePrograms.chain(leafValue, false));
    }

    private static CacheEntry<String> entry(SummaryCache<String> cache, ProcedureId id, SummaryStatus status,
                                            String payload, List<Issue> issues) {
        Summary<String> s = Summary.create(id, cache.computeKey(id), status, payload, STRINGS);
        return new CacheEntry<>(s, issues);
    }

    private static CacheEntry<String> entry(SummaryCache<String> cache, ProcedureId id, String payload) {
        return entry(cache, id, SummaryStatus.OK, payload, Collections.<Issue> emptyList());
    }

    @Test
    public void testMissThenHit() {
        SummaryCache<String> cache = new SummaryCache<>(chain(1), new InMemorySummaryStore<String>());
        assertNull(cache.get(LEAF));
        cache.put(entry(cache, LEAF, "one"));
        CacheEntry<String> e = cache.get(LEAF);
        assertNotNull(e);
        assertEquals("one", e.getSummary().getPayload());
        assertEquals(1, cache.getStatistics().getHits());
        assertEquals(1, cache.getStatistics().getMisses());
        assertEquals(1, cache.getStatistics().getWrites());
    }

    @Test
    public void testCalleeChangeMakesCallerStale() {
        SummaryCache<String> cache = new SummaryCache<>(chain(1), new InMemorySummaryStore<String>());
        cache.put(entry(cache, LEAF, "one"));
        cache.put(entry(cache, MID, "mid"));
        assertNotNull(cache.get(MID));

        cache.put(entry(cache, LEAF, "two"));
        assertNull(cache.get(MID));
        assertEquals(1, cache.getStatistics().getStale());
        // the stale record is still the latest one
        assertEquals("mid", cache.latest(MID).getSummary().getPayload());
    }

    @Test
    public void testSamePayloadKeepsCallerFresh() {
        SummaryCache<String> cache = new SummaryCache<>(chain(1), new InMemorySummaryStore<String>());
        cache.put(entry(cache, LEAF, "one"));
        cache.put(entry(cache, MID, "mid"));
        cache.put(entry(cache, LEAF, SummaryStatus.CONVERGENCE_FORCED, "one", Collections.<Issue> emptyList()));
        assertNotNull(cache.get(MID));
    }

    @Test
    public void testCodeChangeMakesEntryStale() throws IOException {
        InMemorySummaryStore<String> store = new InMemorySummaryStore<>();
        SummaryCache<String> before = new SummaryCache<>(chain(1), store);
        before.put(entry(before, LEAF, "one"));

        SummaryCache<String> after = new SummaryCache<>(chain(2), store);
        assertNull(after.get(LEAF));
        assertNotNull(after.latest(LEAF));
    }

    @Test
    public void testExternalCalleeKey() {
        SummaryCache<String> cache = new SummaryCache<>(chain(1), new InMemorySummaryStore<String>());
        FreshnessKey k = cache.computeKey(OTHER);
        assertEquals(FreshnessKey.EXTERNAL, k.getCalleeHashes().get(LIBRARY));
        assertEquals(FreshnessKey.MISSING, k.getCalleeHashes().get(OTHER_LEAF));
    }

    @Test
    public void testTransientEntry() {
        InMemorySummaryStore<String> store = new InMemorySummaryStore<>();
        SummaryCache<String> cache = new SummaryCache<>(chain(1), store);
        CacheEntry<String> placeholder = entry(cache, LEAF, SummaryStatus.TIMED_OUT, "top",
                                               Collections.<Issue> emptyList());
        cache.putTransient(placeholder);
        assertSame(placeholder, cache.latest(LEAF));
        assertNull(cache.get(LEAF));
        assertEquals(0, store.size());

        cache.put(entry(cache, LEAF, "one"));
        assertEquals("one", cache.latest(LEAF).getSummary().getPayload());
    }

    @Test
    public void testInvalidate() {
        InMemorySummaryStore<String> store = new InMemorySummaryStore<>();
        SummaryCache<String> cache = new SummaryCache<>(chain(1), store);
        cache.put(entry(cache, LEAF, "one"));
        cache.invalidate(LEAF);
        assertNull(cache.latest(LEAF));
        assertEquals(0, store.size());
    }

    @Test
    public void testPersistentStore() throws IOException {
        Path dir = tmp.newFolder("cache").toPath();
        Issue issue = new Issue(new Location(MID, 0, 0, 3), "KIND", "message", Collections.singletonList("step"));

        SummaryCache<String> first = new SummaryCache<>(chain(1), new FileSummaryStore<>(dir, STRINGS));
        first.put(entry(first, LEAF, "one"));
        first.put(entry(first, MID, SummaryStatus.OK, "mid", Collections.singletonList(issue)));

        SummaryCache<String> second = new SummaryCache<>(chain(1), new FileSummaryStore<>(dir, STRINGS));
        CacheEntry<String> mid = second.get(MID);
        assertNotNull(mid);
        assertEquals("mid", mid.getSummary().getPayload());
        assertEquals(Collections.singletonList(issue), mid.getIssues());
        assertEquals(first.latest(MID).getSummary().getHash(), mid.getSummary().getHash());
        assertEquals(2, second.getStatistics().getDiskReads());
    }

    @Test
    public void testUnreadableRecordIsAbsent() throws IOException {
        Path dir = tmp.newFolder("cache").toPath();
        FileSummaryStore<String> store = new FileSummaryStore<>(dir, STRINGS);
        SummaryCache<String> first = new SummaryCache<>(chain(1), store);
        first.put(entry(first, LEAF, "one"));
        Files.write(store.fileFor(LEAF), "{ not json".getBytes(StandardCharsets.UTF_8));

        SummaryCache<String> second = new SummaryCache<>(chain(1), new FileSummaryStore<>(dir, STRINGS));
        assertNull(second.get(LEAF));
        assertEquals(1, second.getStatistics().getUnreadable());

        second.put(entry(second, LEAF, "one"));
        assertTrue(Files.exists(store.fileFor(LEAF)));
        assertFalse(second.get(LEAF) == null);
    }
}
