package org.learningjava.photosearch.application.usecase;

import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.application.port.PhotoSourcePort;
import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.learningjava.photosearch.domain.error.StoreException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.learningjava.photosearch.domain.model.photo.DescribedEmbedding;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome.Kind;
import org.learningjava.photosearch.domain.model.photo.IndexTask;
import org.learningjava.photosearch.domain.service.embedding.EmbeddingProvider;
import org.learningjava.photosearch.domain.service.image.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The per-photo worker step: read, normalize, describe and embed, upsert.
 * Every failure is returned as an {@link IndexOutcome}; nothing is thrown.
 */
@Component
public class PhotoIndexer {

    private static final Logger log = LoggerFactory.getLogger(PhotoIndexer.class);

    private final PhotoSourcePort source;
    private final ImagePreprocessor preprocessor;
    private final EmbeddingProvider provider;
    private final AspectIndexPort index;

    public PhotoIndexer(PhotoSourcePort source,
                        ImagePreprocessor preprocessor,
                        EmbeddingProvider provider,
                        AspectIndexPort index) {
        this.source = source;
        this.preprocessor = preprocessor;
        this.provider = provider;
        this.index = index;
    }

    public IndexOutcome index(IndexTask task) {
        String path = task.photoPath();
        String aspect = task.aspectName();
        try {
            if (task.skipExisting() && index.contains(path, aspect)) {
                log.debug("Skipping {} [{}]: already indexed", path, aspect);
                return IndexOutcome.skipped(path, aspect);
            }

            CanonicalImage image = preprocessor.normalize(source.read(task.photo()));
            DescribedEmbedding described = provider.describeAndEmbed(image, task.prompt());
            index.upsert(path, aspect, described.embedding(), described.description());

            log.info("Indexed {} [{}]", path, aspect);
            return IndexOutcome.indexed(path, aspect);
        } catch (ImageReadException e) {
            return failure(path, aspect, Kind.IMAGE_ERROR, e);
        } catch (ProviderException e) {
            return failure(path, aspect, Kind.PROVIDER_ERROR, e);
        } catch (StoreException e) {
            return failure(path, aspect, Kind.STORE_ERROR, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure indexing {} [{}]", path, aspect, e);
            return IndexOutcome.failed(path, aspect, Kind.INTERNAL_ERROR, String.valueOf(e));
        }
    }

    private IndexOutcome failure(String path, String aspect, Kind kind, RuntimeException e) {
        log.warn("Error processing {} [{}]: {}", path, aspect, e.getMessage());
        return IndexOutcome.failed(path, aspect, kind, e.getMessage());
    }
}
