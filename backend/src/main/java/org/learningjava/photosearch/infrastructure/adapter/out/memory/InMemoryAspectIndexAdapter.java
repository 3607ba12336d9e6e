package org.learningjava.photosearch.infrastructure.adapter.out.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.domain.error.DimensionMismatchException;
import org.learningjava.photosearch.domain.error.StoreException;
import org.learningjava.photosearch.domain.model.photo.EntryId;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.learningjava.photosearch.domain.model.photo.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exact (brute-force) cosine ranking over a {@link ConcurrentHashMap}, for local runs without a
 * Weaviate server and for tests.
 *
 * <p>With a snapshot file the whole index is rewritten after every mutation and reloaded at open,
 * so it survives restarts. Writes to the same key are serialized by {@code compute}.</p>
 */
public class InMemoryAspectIndexAdapter implements AspectIndexPort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAspectIndexAdapter.class);

    private final Map<String, PhotoRecord> records = new ConcurrentHashMap<>();
    private final AtomicInteger dimension = new AtomicInteger(0); // 0 = not fixed yet
    private final Path snapshotFile;                               // nullable
    private final Object snapshotLock = new Object();
    private final ObjectMapper om = new ObjectMapper();

    public InMemoryAspectIndexAdapter() {
        this(null);
    }

    public InMemoryAspectIndexAdapter(Path snapshotFile) {
        this.snapshotFile = snapshotFile;
    }

    @Override
    public void ensureSchema() {
        if (snapshotFile == null || !Files.exists(snapshotFile)) {
            return;
        }
        synchronized (snapshotLock) {
            try {
                Snapshot snap = om.readValue(snapshotFile.toFile(), Snapshot.class);
                records.clear();
                for (Snapshot.Entry e : snap.records()) {
                    PhotoRecord r = new PhotoRecord(e.photoPath(), e.aspectName(), e.description(), e.embedding());
                    records.put(r.entryId().value(), r);
                }
                dimension.set(records.isEmpty() ? 0 : snap.dimension());
                log.info("Loaded {} records (dim={}) from {}", records.size(), dimension.get(), snapshotFile);
            } catch (IOException e) {
                throw new StoreException("Cannot load index snapshot " + snapshotFile + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void upsert(String photoPath, String aspectName, float[] embedding, String description) {
        if (embedding == null || embedding.length == 0) {
            throw new StoreException("Refusing to store an empty embedding for " + photoPath + " [" + aspectName + "]");
        }
        checkDimension(embedding.length, true);

        PhotoRecord record = new PhotoRecord(photoPath, aspectName, description, embedding);
        records.compute(record.entryId().value(), (id, previous) -> record);
        persist();
    }

    @Override
    public List<SearchResult> query(float[] embedding, int k, String aspectFilter) {
        if (k <= 0 || records.isEmpty()) return List.of();
        checkDimension(embedding.length, false);

        double queryNorm = norm(embedding);
        List<SearchResult> ranked = new ArrayList<>();
        for (PhotoRecord r : records.values()) {
            if (aspectFilter != null && !aspectFilter.equals(r.aspectName())) continue;
            double d = cosineDistance(embedding, queryNorm, r.embedding());
            ranked.add(new SearchResult(r.photoPath(), r.aspectName(), d, r.description()));
        }
        ranked.sort(SearchResult.BY_DISTANCE);
        return ranked.size() > k ? List.copyOf(ranked.subList(0, k)) : ranked;
    }

    @Override
    public int delete(String photoPath, String aspectName) {
        int deleted;
        if (aspectName != null) {
            deleted = records.remove(EntryId.of(photoPath, aspectName).value()) != null ? 1 : 0;
        } else {
            deleted = 0;
            for (PhotoRecord r : records.values()) {
                if (r.photoPath().equals(photoPath) && records.remove(r.entryId().value(), r)) {
                    deleted++;
                }
            }
        }
        if (deleted > 0) persist();
        return deleted;
    }

    @Override
    public boolean contains(String photoPath, String aspectName) {
        return records.containsKey(EntryId.of(photoPath, aspectName).value());
    }

    @Override
    public List<PhotoRecord> findByPhoto(String photoPath) {
        return records.values().stream()
                .filter(r -> r.photoPath().equals(photoPath))
                .sorted(Comparator.comparing(PhotoRecord::aspectName))
                .toList();
    }

    @Override
    public Set<String> listPhotoPaths() {
        Set<String> paths = new TreeSet<>();
        for (PhotoRecord r : records.values()) paths.add(r.photoPath());
        return paths;
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public void clear() {
        records.clear();
        dimension.set(0);
        persist();
        log.info("In-memory aspect index cleared");
    }

    // ---------- INTERNALS ----------

    private void checkDimension(int actual, boolean fixIfUnset) {
        int expected = dimension.get();
        if (expected == 0) {
            if (!fixIfUnset) return;
            if (dimension.compareAndSet(0, actual)) return;
            expected = dimension.get();
        }
        if (expected != actual) {
            throw new DimensionMismatchException(expected, actual);
        }
    }

    static double cosineDistance(float[] q, double qNorm, float[] v) {
        double dot = 0.0, vv = 0.0;
        for (int i = 0; i < q.length; i++) {
            dot += (double) q[i] * v[i];
            vv += (double) v[i] * v[i];
        }
        double denom = qNorm * Math.sqrt(vv);
        if (denom == 0.0) return 1.0;
        return 1.0 - dot / denom;
    }

    private static double norm(float[] v) {
        double s = 0.0;
        for (float f : v) s += (double) f * f;
        return Math.sqrt(s);
    }

    private void persist() {
        if (snapshotFile == null) return;
        synchronized (snapshotLock) {
            List<Snapshot.Entry> entries = records.values().stream()
                    .sorted(Comparator.comparing(PhotoRecord::photoPath).thenComparing(PhotoRecord::aspectName))
                    .map(r -> new Snapshot.Entry(r.photoPath(), r.aspectName(), r.description(), r.embedding()))
                    .toList();
            try {
                Path parent = snapshotFile.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Path tmp = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
                om.writeValue(tmp.toFile(), new Snapshot(dimension.get(), entries));
                Files.move(tmp, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StoreException("Cannot write index snapshot " + snapshotFile + ": " + e.getMessage(), e);
            }
        }
    }

    record Snapshot(int dimension, List<Entry> records) {
        record Entry(String photoPath, String aspectName, String description, float[] embedding) {}
    }
}
