package analysis.summary;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import analysis.ir.ProcedureId;
import util.Hashing;

/**
 * Store keeping one JSON record per procedure in a directory. The file name is the SHA-256 of the procedure id. A
 * record is written to a temporary file in the same directory and then moved over the old one, so a crash while
 * writing leaves the previous record intact.
 */
public final class FileSummaryStore<S> implements SummaryStore<S> {

    private static final String SUFFIX = ".json";

    private final Path dir;
    private final SummaryCodec<S> codec;

    /**
     * Open (and create if necessary) a store directory
     *
     * @param dir
     *            directory holding the records
     * @param codec
     *            codec for summary payloads
     * @throws IOException
     *             if the directory cannot be created
     */
    public FileSummaryStore(Path dir, SummaryCodec<S> codec) throws IOException {
        this.dir = Files.createDirectories(dir);
        this.codec = codec;
    }

    public Path getDirectory() {
        return dir;
    }

    Path fileFor(ProcedureId id) {
        return dir.resolve(Hashing.sha256(id.toString()) + SUFFIX);
    }

    @Override
    public CacheEntry<S> read(ProcedureId id) throws IOException {
        Path f = fileFor(id);
        if (!Files.exists(f)) {
            return null;
        }
        try (BufferedReader r = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
            CacheEntry<S> e = SummaryJson.entryFromJSON(new JSONObject(new JSONTokener(r)), codec);
            if (!e.getProcedure().equals(id)) {
                throw new IOException("Record " + f + " is for " + e.getProcedure() + " not " + id);
            }
            return e;
        }
        catch (JSONException e) {
            throw new IOException("Malformed summary record " + f, e);
        }
    }

    @Override
    public void write(CacheEntry<S> entry) throws IOException {
        Path target = fileFor(entry.getProcedure());
        Path tmp = Files.createTempFile(dir, "summary", ".tmp");
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(SummaryJson.toJSON(entry, codec).toString());
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public void delete(ProcedureId id) throws IOException {
        Files.deleteIfExists(fileFor(id));
    }

    @Override
    public boolean isPersistent() {
        return true;
    }

    @Override
    public String toString() {
        return "FileSummaryStore(" + dir + ")";
    }
}
