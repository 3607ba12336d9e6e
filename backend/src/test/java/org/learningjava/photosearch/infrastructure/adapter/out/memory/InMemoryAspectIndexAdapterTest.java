package org.learningjava.photosearch.infrastructure.adapter.out.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.photosearch.domain.error.DimensionMismatchException;
import org.learningjava.photosearch.domain.error.StoreException;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.learningjava.photosearch.domain.model.photo.SearchResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAspectIndexAdapterTest {

    private static final float[] RED = {1f, 0f, 0f};
    private static final float[] GREEN = {0f, 1f, 0f};
    private static final float[] BLUE = {0f, 0f, 1f};
    private static final float[] REDDISH = {0.9f, 0.1f, 0f};

    private InMemoryAspectIndexAdapter index;

    @BeforeEach
    void setUp() {
        index = new InMemoryAspectIndexAdapter();
        index.ensureSchema();
    }

    @Test
    void upsert_twice_keepsOneRecordWithLatestValues() {
        index.upsert("/p/a.jpg", "default", RED, "first");
        index.upsert("/p/a.jpg", "default", GREEN, "second");

        assertEquals(1, index.count());
        List<PhotoRecord> records = index.findByPhoto("/p/a.jpg");
        assertEquals(1, records.size());
        assertEquals("second", records.get(0).description());
        assertArrayEquals(GREEN, records.get(0).embedding());
    }

    @Test
    void upsert_identicalArgumentsIsIdempotent() {
        index.upsert("/p/a.jpg", "default", RED, "a red car");
        index.upsert("/p/a.jpg", "default", RED, "a red car");

        assertEquals(1, index.count());
        assertEquals(List.of(new PhotoRecord("/p/a.jpg", "default", "a red car", RED)), index.findByPhoto("/p/a.jpg"));
    }

    @Test
    void aspects_areIndependentRecords() {
        index.upsert("/p/a.jpg", "A", RED, "aspect a");
        index.upsert("/p/a.jpg", "B", GREEN, "aspect b");
        assertEquals(2, index.count());

        assertEquals(1, index.delete("/p/a.jpg", "A"));
        assertFalse(index.contains("/p/a.jpg", "A"));
        assertTrue(index.contains("/p/a.jpg", "B"));

        index.upsert("/p/a.jpg", "A", RED, "aspect a");
        assertEquals(2, index.delete("/p/a.jpg", null));
        assertEquals(0, index.count());
        assertTrue(index.listPhotoPaths().isEmpty());
    }

    @Test
    void keysContainingTheSeparatorStayDistinct() {
        index.upsert("/photos/a|b.jpg", "default", RED, "first photo");
        index.upsert("/photos/a", "b.jpg|default", GREEN, "second photo");

        assertEquals(2, index.count());
        assertEquals(Set.of("/photos/a|b.jpg", "/photos/a"), index.listPhotoPaths());

        assertEquals(1, index.delete("/photos/a", "b.jpg|default"));
        assertEquals(1, index.count());
        assertEquals("first photo", index.findByPhoto("/photos/a|b.jpg").get(0).description());
    }

    @Test
    void delete_missingKeyReturnsZero() {
        index.upsert("/p/a.jpg", "default", RED, "x");

        assertEquals(0, index.delete("/p/other.jpg", "default"));
        assertEquals(0, index.delete("/p/a.jpg", "color"));
        assertEquals(0, index.delete("/p/other.jpg", null));
        assertEquals(1, index.count());
    }

    @Test
    void query_ordersByAscendingDistanceAndIsRepeatable() {
        index.upsert("/p/red.jpg", "default", RED, "red");
        index.upsert("/p/green.jpg", "default", GREEN, "green");
        index.upsert("/p/blue.jpg", "default", BLUE, "blue");
        index.upsert("/p/reddish.jpg", "default", REDDISH, "reddish");

        List<SearchResult> first = index.query(RED, 10, null);
        List<SearchResult> second = index.query(RED, 10, null);

        assertEquals(4, first.size());
        assertEquals("/p/red.jpg", first.get(0).photoPath());
        assertEquals("/p/reddish.jpg", first.get(1).photoPath());
        for (int i = 1; i < first.size(); i++) {
            assertTrue(first.get(i - 1).distance() <= first.get(i).distance(), "distances must not decrease");
        }
        assertEquals(first, second);
        assertEquals(0.0, first.get(0).distance(), 1e-6);
    }

    @Test
    void query_equalDistancesAreBrokenByPathThenAspect() {
        index.upsert("/p/b.jpg", "default", GREEN, "b");
        index.upsert("/p/a.jpg", "x", GREEN, "a-x");
        index.upsert("/p/a.jpg", "default", GREEN, "a-default");

        List<SearchResult> hits = index.query(RED, 5, null);

        assertEquals(List.of("/p/a.jpg", "/p/a.jpg", "/p/b.jpg"), hits.stream().map(SearchResult::photoPath).toList());
        assertEquals("default", hits.get(0).aspectName());
        assertEquals("x", hits.get(1).aspectName());
    }

    @Test
    void query_kLargerThanStoreIsClamped() {
        index.upsert("/p/1.jpg", "default", RED, "1");
        index.upsert("/p/2.jpg", "default", GREEN, "2");
        index.upsert("/p/3.jpg", "default", BLUE, "3");

        assertEquals(3, index.query(RED, 100, null).size());
        assertEquals(2, index.query(RED, 2, null).size());
        assertTrue(index.query(RED, 0, null).isEmpty());
    }

    @Test
    void query_aspectFilterOnlyReturnsThatAspect() {
        index.upsert("/p/1.jpg", "A", RED, "1a");
        index.upsert("/p/1.jpg", "B", RED, "1b");
        index.upsert("/p/2.jpg", "B", GREEN, "2b");
        index.upsert("/p/3.jpg", "A", BLUE, "3a");

        List<SearchResult> hits = index.query(RED, 10, "B");

        assertEquals(2, hits.size());
        assertTrue(hits.stream().allMatch(h -> h.aspectName().equals("B")));
        assertEquals("1b", hits.get(0).description());
    }

    @Test
    void query_onEmptyStoreOrUnknownAspectReturnsEmpty() {
        assertTrue(index.query(RED, 5, null).isEmpty());

        index.upsert("/p/1.jpg", "default", RED, "1");
        assertTrue(index.query(RED, 5, "color").isEmpty());
    }

    @Test
    void deleteOneAspect_keepsPhotoListedButFilteredQueryEmpty() {
        index.upsert("/p/P.jpg", "default", RED, "d");
        index.upsert("/p/P.jpg", "color", GREEN, "c");

        index.delete("/p/P.jpg", "color");

        assertEquals(Set.of("/p/P.jpg"), index.listPhotoPaths());
        assertEquals(List.of(), index.query(GREEN, 5, "color"));
    }

    @Test
    void upsert_rejectsDifferentDimensionality() {
        index.upsert("/p/1.jpg", "default", RED, "1");

        DimensionMismatchException ex = assertThrows(DimensionMismatchException.class,
                () -> index.upsert("/p/2.jpg", "default", new float[]{1f, 2f}, "2"));
        assertEquals(3, ex.getExpected());
        assertEquals(2, ex.getActual());
        assertEquals(1, index.count());
    }

    @Test
    void upsert_rejectsEmptyEmbedding() {
        assertThrows(StoreException.class, () -> index.upsert("/p/1.jpg", "default", new float[0], "x"));
    }

    @Test
    void clear_emptiesAndStaysUsable() {
        index.upsert("/p/1.jpg", "default", RED, "1");
        index.upsert("/p/2.jpg", "color", GREEN, "2");

        index.clear();
        assertEquals(0, index.count());
        assertTrue(index.listPhotoPaths().isEmpty());

        // dimensionality may change after a clear
        index.upsert("/p/3.jpg", "default", new float[]{1f, 1f}, "3");
        assertEquals(1, index.query(new float[]{1f, 1f}, 5, null).size());
    }

    @Test
    void snapshot_survivesReopen(@TempDir Path tmp) {
        Path file = tmp.resolve("index.json");
        InMemoryAspectIndexAdapter first = new InMemoryAspectIndexAdapter(file);
        first.ensureSchema();
        first.upsert("/p/1.jpg", "default", RED, "red one");
        first.upsert("/p/1.jpg", "color", GREEN, "green tint");
        first.upsert("/p/2.jpg", "default", BLUE, "blue two");
        first.delete("/p/2.jpg", null);
        assertTrue(Files.exists(file));

        InMemoryAspectIndexAdapter reopened = new InMemoryAspectIndexAdapter(file);
        reopened.ensureSchema();

        assertEquals(2, reopened.count());
        assertEquals(Set.of("/p/1.jpg"), reopened.listPhotoPaths());
        assertEquals("red one", reopened.query(RED, 1, "default").get(0).description());
        assertThrows(DimensionMismatchException.class,
                () -> reopened.upsert("/p/9.jpg", "default", new float[]{1f}, "bad"));
    }

    @Test
    void concurrentUpserts_toDistinctKeysAreAllKept() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int n = i;
                futures.add(pool.submit(() -> index.upsert("/p/" + n + ".jpg", n % 2 == 0 ? "A" : "B",
                        new float[]{n, 1f, 0f}, "photo " + n)));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertEquals(200, index.count());
        assertEquals(200, index.listPhotoPaths().size());
        assertEquals(100, index.query(RED, 500, "A").size());
    }
}
