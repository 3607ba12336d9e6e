package org.learningjava.photosearch.application.usecase;

import org.learningjava.photosearch.application.port.PhotoSourcePort;
import org.learningjava.photosearch.domain.error.PhotoSearchException;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.learningjava.photosearch.domain.error.StoreException;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexTask;
import org.learningjava.photosearch.domain.model.photo.IndexingReport;
import org.learningjava.photosearch.domain.model.photo.IndexingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Indexes every image under a directory for one aspect, with a bounded pool of workers.
 * An unreadable file or a provider failure shows up as a failed {@link IndexOutcome} and the run goes on.
 * A store failure ends the run.
 */
@Service
public class IndexPhotosUseCase {

    private static final Logger log = LoggerFactory.getLogger(IndexPhotosUseCase.class);

    @FunctionalInterface
    public interface ProgressListener {
        void onOutcome(IndexOutcome outcome, int processed, int total);

        ProgressListener NONE = (o, p, t) -> { };
    }

    private final PhotoSourcePort source;
    private final PhotoIndexer indexer;

    public IndexPhotosUseCase(PhotoSourcePort source, PhotoIndexer indexer) {
        this.source = source;
        this.indexer = indexer;
    }

    public IndexingReport run(IndexingRequest request) {
        return run(request, ProgressListener.NONE);
    }

    public IndexingReport run(IndexingRequest request, ProgressListener listener) {
        if (request.concurrency() < 1) {
            throw new QueryValidationException("concurrency must be >= 1, got " + request.concurrency());
        }
        Path root = request.rootDir();
        List<Path> photos = source.discoverPhotos(root);

        long t0 = System.nanoTime();
        log.info("Indexing {} images under {} as aspect '{}' with {} workers (skipExisting={})",
                photos.size(), root, request.aspectName(), request.concurrency(), request.skipExisting());

        List<IndexOutcome> outcomes = new ArrayList<>(photos.size());
        if (!photos.isEmpty()) {
            try (IndexingWorkerPool pool = new IndexingWorkerPool(request.concurrency(), indexer::index)) {
                for (Path photo : photos) {
                    pool.submit(new IndexTask(photo, request.aspectName(), request.prompt(), request.skipExisting()));
                }
                for (int i = 0; i < photos.size(); i++) {
                    IndexOutcome outcome = pool.take();
                    outcomes.add(outcome);
                    listener.onOutcome(outcome, outcomes.size(), photos.size());
                    if (outcome.kind() == IndexOutcome.Kind.STORE_ERROR) {
                        // closing the pool cancels whatever is still queued
                        throw new StoreException("Indexing of " + root + " aborted after "
                                + outcomes.size() + "/" + photos.size() + " images. " + outcome.message());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PhotoSearchException("Indexing of " + root + " interrupted after "
                        + outcomes.size() + "/" + photos.size() + " images", e);
            }
        }

        IndexingReport report = IndexingReport.of(root.toString(), request.aspectName(), outcomes,
                Duration.ofNanos(System.nanoTime() - t0));
        log.info("Indexing complete for {}: total={}, succeeded={} (skipped={}), errors={}, took={} ms",
                root, report.total(), report.succeeded(), report.skipped(), report.failed(),
                report.elapsed().toMillis());
        return report;
    }
}
