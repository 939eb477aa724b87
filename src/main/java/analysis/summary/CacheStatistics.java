package analysis.summary;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters kept by a {@link SummaryCache}
 */
public final class CacheStatistics {

    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();
    private final AtomicInteger stale = new AtomicInteger();
    private final AtomicInteger diskReads = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicInteger unreadable = new AtomicInteger();

    void recordHit() {
        hits.incrementAndGet();
    }

    /**
     * @param wasStale
     *            true if there was an entry but its key no longer matched
     */
    void recordMiss(boolean wasStale) {
        misses.incrementAndGet();
        if (wasStale) {
            stale.incrementAndGet();
        }
    }

    void recordDiskRead() {
        diskReads.incrementAndGet();
    }

    void recordWrite() {
        writes.incrementAndGet();
    }

    void recordUnreadable() {
        unreadable.incrementAndGet();
    }

    public int getHits() {
        return hits.get();
    }

    public int getMisses() {
        return misses.get();
    }

    /**
     * Misses for which an entry existed but was computed against different code or callee summaries
     *
     * @return number of stale lookups
     */
    public int getStale() {
        return stale.get();
    }

    public int getDiskReads() {
        return diskReads.get();
    }

    public int getWrites() {
        return writes.get();
    }

    public int getUnreadable() {
        return unreadable.get();
    }

    @Override
    public String toString() {
        return "hits=" + hits + " misses=" + misses + " (stale=" + stale + ") diskReads=" + diskReads + " writes="
                + writes + " unreadable=" + unreadable;
    }
}
