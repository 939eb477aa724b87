package analysis.summary;

import java.io.IOException;

import analysis.ir.ProcedureId;

/**
 * Backing storage of the {@link SummaryCache}. Holds at most one entry per procedure. Implementations must make a
 * {@link #write(CacheEntry)} visible atomically: a reader sees either the old or the new entry, never a part of one.
 *
 * @param <S>
 *            summary payload type
 */
public interface SummaryStore<S> {

    /**
     * Most recently written entry for the procedure
     *
     * @param id
     *            procedure
     * @return entry, or null if there is none
     * @throws IOException
     *             if the stored record cannot be read
     */
    CacheEntry<S> read(ProcedureId id) throws IOException;

    /**
     * Replace the entry for the entry's procedure
     *
     * @param entry
     *            entry to store
     * @throws IOException
     *             if the entry cannot be written
     */
    void write(CacheEntry<S> entry) throws IOException;

    /**
     * Remove the entry for the procedure, if any
     *
     * @param id
     *            procedure
     * @throws IOException
     *             if the record cannot be removed
     */
    void delete(ProcedureId id) throws IOException;

    /**
     * True if reads may touch the disk, used for statistics only
     *
     * @return whether the store is persistent
     */
    boolean isPersistent();
}
