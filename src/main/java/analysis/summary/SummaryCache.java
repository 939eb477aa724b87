package analysis.summary;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import analysis.callgraph.CallGraph;
import analysis.ir.ProcedureDescriptor;
import analysis.ir.ProcedureId;
import util.Logger;

/**
 * Summaries of the procedures in one call graph, backed by a {@link SummaryStore}. An entry is returned by
 * {@link #get(ProcedureId)} only if it is fresh, i.e. it was computed against the procedure's current code and the
 * current summaries of all its direct callees.
 * <p>
 * Only the coordinator writes to the cache, and only one work item per procedure is in flight at a time, so there is a
 * single writer per key. Reads may come from any thread.
 *
 * @param <S>
 *            summary payload type
 */
public final class SummaryCache<S> {

    private final CallGraph cg;
    private final SummaryStore<S> store;
    /**
     * Entries read from or written to the store in this run
     */
    private final ConcurrentHashMap<ProcedureId, CacheEntry<S>> loaded = new ConcurrentHashMap<>();
    /**
     * Procedures known to have no stored entry
     */
    private final Set<ProcedureId> absent = ConcurrentHashMap.newKeySet();
    /**
     * Placeholders for procedures whose analysis failed in this run, never persisted
     */
    private final ConcurrentHashMap<ProcedureId, CacheEntry<S>> transientEntries = new ConcurrentHashMap<>();
    private final CacheStatistics stats = new CacheStatistics();
    private int outputLevel = 0;

    public SummaryCache(CallGraph cg, SummaryStore<S> store) {
        this.cg = cg;
        this.store = store;
    }

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    public CacheStatistics getStatistics() {
        return stats;
    }

    public SummaryStore<S> getStore() {
        return store;
    }

    /**
     * Fresh entry for the procedure
     *
     * @param id
     *            procedure
     * @return entry whose key equals {@link #computeKey(ProcedureId)}, null otherwise
     */
    public CacheEntry<S> get(ProcedureId id) {
        CacheEntry<S> e = stored(id);
        if (e == null) {
            stats.recordMiss(false);
            return null;
        }
        if (!e.getKey().equals(computeKey(id))) {
            if (outputLevel >= 2) {
                System.err.println("Stale summary for " + id);
            }
            stats.recordMiss(true);
            return null;
        }
        stats.recordHit();
        return e;
    }

    /**
     * Most recent entry regardless of freshness, including placeholders for procedures that failed in this run
     *
     * @param id
     *            procedure
     * @return latest entry or null
     */
    public CacheEntry<S> latest(ProcedureId id) {
        CacheEntry<S> t = transientEntries.get(id);
        if (t != null) {
            return t;
        }
        return stored(id);
    }

    /**
     * Record a newly computed entry, replacing any placeholder
     *
     * @param entry
     *            entry to store
     * @throws UncheckedIOException
     *             if the store cannot write the entry
     */
    public void put(CacheEntry<S> entry) {
        ProcedureId id = entry.getProcedure();
        try {
            store.write(entry);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not store summary for " + id, e);
        }
        stats.recordWrite();
        loaded.put(id, entry);
        absent.remove(id);
        transientEntries.remove(id);
    }

    /**
     * Record a placeholder for a procedure whose analysis failed. Callers use it this run, it is never written to the
     * store, and it is never a cache hit.
     *
     * @param entry
     *            placeholder entry
     */
    public void putTransient(CacheEntry<S> entry) {
        assert entry.getSummary().getStatus().isFailure() : "Transient entry for a successful analysis " + entry;
        transientEntries.put(entry.getProcedure(), entry);
    }

    /**
     * Forget everything known about the procedure
     *
     * @param id
     *            procedure
     */
    public void invalidate(ProcedureId id) {
        loaded.remove(id);
        absent.add(id);
        transientEntries.remove(id);
        try {
            store.delete(id);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not remove summary for " + id, e);
        }
    }

    /**
     * Key a summary of <code>id</code> computed now would have: the current code hash and the latest summary hash of
     * every direct callee (callees in the same SCC included)
     *
     * @param id
     *            procedure in the call graph
     * @return freshness key
     */
    public FreshnessKey computeKey(ProcedureId id) {
        ProcedureDescriptor pd = cg.getDescriptor(id);
        assert pd != null : "No descriptor for " + id;
        Map<ProcedureId, String> callees = new TreeMap<>();
        for (ProcedureId callee : cg.getCallees(id)) {
            CacheEntry<S> e = latest(callee);
            callees.put(callee, e == null ? FreshnessKey.MISSING : e.getSummary().getHash());
        }
        for (ProcedureId ext : cg.getExternalCallees(id)) {
            callees.put(ext, FreshnessKey.EXTERNAL);
        }
        return new FreshnessKey(pd.codeHash(), callees);
    }

    private CacheEntry<S> stored(ProcedureId id) {
        CacheEntry<S> e = loaded.get(id);
        if (e != null || absent.contains(id)) {
            return e;
        }
        try {
            e = store.read(id);
            if (store.isPersistent()) {
                stats.recordDiskRead();
            }
        }
        catch (IOException ex) {
            // an unreadable record is recomputed
            Logger.println(1, "Discarding unreadable summary for " + id + ": " + ex.getMessage());
            stats.recordUnreadable();
            e = null;
        }
        if (e == null) {
            absent.add(id);
        }
        else {
            loaded.put(id, e);
        }
        return e;
    }

    @Override
    public String toString() {
        return "SummaryCache(" + store + ", " + stats + ")";
    }
}
