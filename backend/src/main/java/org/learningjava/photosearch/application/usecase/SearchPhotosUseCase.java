package org.learningjava.photosearch.application.usecase;

import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.learningjava.photosearch.domain.model.photo.PhotoQuery;
import org.learningjava.photosearch.domain.model.photo.SearchResult;
import org.learningjava.photosearch.domain.service.embedding.EmbeddingProvider;
import org.learningjava.photosearch.domain.service.image.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Two-stage query engine: turn the query into an embedding, then rank the aspect index.
 * Provider and store failures propagate; there are no partial results.
 */
@Service
public class SearchPhotosUseCase {
    private static final Logger log = LoggerFactory.getLogger(SearchPhotosUseCase.class);

    private final ImagePreprocessor preprocessor;
    private final EmbeddingProvider provider;
    private final AspectIndexPort index;

    public SearchPhotosUseCase(ImagePreprocessor preprocessor,
                               EmbeddingProvider provider,
                               AspectIndexPort index) {
        this.preprocessor = preprocessor;
        this.provider = provider;
        this.index = index;
    }

    public List<SearchResult> search(PhotoQuery query) {
        if (query.hasImage()) {
            return searchByImage(query.image(), query.aspectFilter(), query.k());
        }
        if (query.hasText()) {
            return searchByText(query.text(), query.aspectFilter(), query.k());
        }
        throw new QueryValidationException("Either a query image or query text must be provided");
    }

    public List<SearchResult> searchByImage(byte[] image, String aspectFilter, int k) {
        if (image == null || image.length == 0) {
            throw new QueryValidationException("Query image is empty");
        }
        CanonicalImage canonical = preprocessor.normalize(image);
        // the description only matters for indexing
        float[] qVec = provider.describeAndEmbed(canonical, null).embedding();
        return rank(qVec, aspectFilter, k, "image " + canonical.width() + "x" + canonical.height());
    }

    public List<SearchResult> searchByText(String text, String aspectFilter, int k) {
        if (text == null || text.isBlank()) {
            throw new QueryValidationException("Query text is blank");
        }
        float[] qVec = provider.embedText(text);
        return rank(qVec, aspectFilter, k, "text '" + text + "'");
    }

    private List<SearchResult> rank(float[] qVec, String aspectFilter, int k, String what) {
        String filter = (aspectFilter == null || aspectFilter.isBlank()) ? null : aspectFilter.trim();
        List<SearchResult> hits = index.query(qVec, k, filter);
        if (hits.isEmpty()) {
            log.info("No results for {} (aspect={}, k={})", what, filter, k);
        } else if (log.isDebugEnabled()) {
            log.debug("{} results for {} (aspect={}, k={}), best={} at {}",
                    hits.size(), what, filter, k, hits.get(0).photoPath(), hits.get(0).distance());
        }
        return hits;
    }
}
