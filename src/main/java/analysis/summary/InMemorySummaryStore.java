package analysis.summary;

import java.util.concurrent.ConcurrentHashMap;

import analysis.ir.ProcedureId;

/**
 * Store that lives only as long as the object. Shared between runs in the same JVM (e.g. by tests) simply by reusing
 * the instance.
 */
public final class InMemorySummaryStore<S> implements SummaryStore<S> {

    private final ConcurrentHashMap<ProcedureId, CacheEntry<S>> entries = new ConcurrentHashMap<>();

    @Override
    public CacheEntry<S> read(ProcedureId id) {
        return entries.get(id);
    }

    @Override
    public void write(CacheEntry<S> entry) {
        entries.put(entry.getProcedure(), entry);
    }

    @Override
    public void delete(ProcedureId id) {
        entries.remove(id);
    }

    @Override
    public boolean isPersistent() {
        return false;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "InMemorySummaryStore(" + entries.size() + ")";
    }
}
