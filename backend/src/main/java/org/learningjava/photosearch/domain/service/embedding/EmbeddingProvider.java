package org.learningjava.photosearch.domain.service.embedding;

import org.learningjava.photosearch.application.port.EmbeddingPort;
import org.learningjava.photosearch.application.port.ImageDescriptionPort;
import org.learningjava.photosearch.application.port.ModelCatalogPort;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.learningjava.photosearch.domain.model.photo.DescribedEmbedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Describe-then-embed over the provider ports.
 *
 * <p>Image embeddings are always text embeddings of the generated description, so image queries and
 * text queries land in the same similarity space.</p>
 */
public class EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingProvider.class);

    public static final String DEFAULT_PROMPT = "Describe this image in detail:";

    private final ImageDescriptionPort describer;
    private final EmbeddingPort embedding;
    private final ModelCatalogPort catalog;
    private final String defaultPrompt;

    public EmbeddingProvider(ImageDescriptionPort describer,
                             EmbeddingPort embedding,
                             ModelCatalogPort catalog,
                             String defaultPrompt) {
        this.describer = describer;
        this.embedding = embedding;
        this.catalog = catalog;
        this.defaultPrompt = (defaultPrompt == null || defaultPrompt.isBlank()) ? DEFAULT_PROMPT : defaultPrompt;
    }

    public DescribedEmbedding describeAndEmbed(CanonicalImage image, String prompt) {
        String effectivePrompt = (prompt == null || prompt.isBlank()) ? defaultPrompt : prompt;

        String description = describer.describe(image, effectivePrompt);
        if (description == null || description.isBlank()) {
            throw new ProviderException("Model '" + describer.model() + "' returned an empty description");
        }

        float[] vector = embedText(description);
        if (log.isDebugEnabled()) {
            log.debug("Described image {}x{} in {} chars, dim={}",
                    image.width(), image.height(), description.length(), vector.length);
        }
        return new DescribedEmbedding(description, vector);
    }

    public float[] embedText(String text) {
        float[] v = embedding.embed(text);
        if (v == null || v.length == 0) {
            throw new ProviderException("Model '" + embedding.model() + "' returned an empty embedding");
        }
        return v;
    }

    public List<String> listAvailableModels() {
        return catalog.listModels();
    }
}
