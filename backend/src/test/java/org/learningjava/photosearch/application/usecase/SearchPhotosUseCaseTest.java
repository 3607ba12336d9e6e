package org.learningjava.photosearch.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.learningjava.photosearch.domain.model.photo.DescribedEmbedding;
import org.learningjava.photosearch.domain.model.photo.PhotoQuery;
import org.learningjava.photosearch.domain.model.photo.SearchResult;
import org.learningjava.photosearch.domain.service.embedding.EmbeddingProvider;
import org.learningjava.photosearch.domain.service.image.ImagePreprocessor;
import org.learningjava.photosearch.infrastructure.adapter.out.memory.InMemoryAspectIndexAdapter;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SearchPhotosUseCaseTest {

    private EmbeddingProvider provider;
    private AspectIndexPort index;
    private SearchPhotosUseCase useCase;

    @BeforeEach
    void setUp() {
        provider = mock(EmbeddingProvider.class);
        index = new InMemoryAspectIndexAdapter();
        index.upsert("/p/a.jpg", "default", new float[]{1f, 0f, 0f}, "a red car");
        index.upsert("/p/b.jpg", "default", new float[]{0f, 1f, 0f}, "a blue sky");
        index.upsert("/p/b.jpg", "color", new float[]{0.8f, 0.2f, 0f}, "mostly blue");
        useCase = new SearchPhotosUseCase(new ImagePreprocessor(), provider, index);
    }

    private static byte[] png() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB), "png", out);
        return out.toByteArray();
    }

    @Test
    void searchByText_ranksClosestDescriptionFirst() {
        when(provider.embedText("red vehicle")).thenReturn(new float[]{0.9f, 0.1f, 0f});

        List<SearchResult> hits = useCase.searchByText("red vehicle", "default", 2);

        assertEquals(2, hits.size());
        assertEquals("/p/a.jpg", hits.get(0).photoPath());
        assertEquals("a red car", hits.get(0).description());
        assertTrue(hits.get(0).distance() < hits.get(1).distance());
    }

    @Test
    void searchByText_withoutFilterRanksAllAspects() {
        when(provider.embedText(anyString())).thenReturn(new float[]{0.9f, 0.1f, 0f});

        List<SearchResult> hits = useCase.searchByText("red vehicle", null, 10);

        assertEquals(3, hits.size());
    }

    @Test
    void searchByText_blankFilterMeansNoFilter() {
        when(provider.embedText(anyString())).thenReturn(new float[]{0.9f, 0.1f, 0f});

        assertEquals(3, useCase.searchByText("red vehicle", "  ", 10).size());
    }

    @Test
    void searchByText_unknownAspectGivesEmptyList() {
        when(provider.embedText(anyString())).thenReturn(new float[]{1f, 0f, 0f});

        assertTrue(useCase.searchByText("anything", "mood", 5).isEmpty());
    }

    @Test
    void searchByText_blankTextIsRejected() {
        assertThrows(QueryValidationException.class, () -> useCase.searchByText(" ", null, 5));
        verifyNoInteractions(provider);
    }

    @Test
    void searchByImage_usesDescriptionEmbedding() throws IOException {
        when(provider.describeAndEmbed(any(CanonicalImage.class), isNull()))
                .thenReturn(new DescribedEmbedding("sky", new float[]{0f, 1f, 0f}));

        List<SearchResult> hits = useCase.searchByImage(png(), "default", 1);

        assertEquals(1, hits.size());
        assertEquals("/p/b.jpg", hits.get(0).photoPath());
        assertEquals(0.0, hits.get(0).distance(), 1e-6);
    }

    @Test
    void searchByImage_corruptBytesAreImageError() {
        assertThrows(ImageReadException.class, () -> useCase.searchByImage("nope".getBytes(), null, 5));
    }

    @Test
    void searchByImage_emptyBytesAreRejected() {
        assertThrows(QueryValidationException.class, () -> useCase.searchByImage(new byte[0], null, 5));
    }

    @Test
    void search_imageWinsOverText() throws IOException {
        when(provider.describeAndEmbed(any(), any())).thenReturn(new DescribedEmbedding("sky", new float[]{0f, 1f, 0f}));

        useCase.search(new PhotoQuery(png(), "red vehicle", null, 3));

        verify(provider, never()).embedText(anyString());
    }

    @Test
    void search_withNeitherImageNorTextIsRejected() {
        assertThrows(QueryValidationException.class, () -> useCase.search(new PhotoQuery(null, " ", null, 3)));
    }

    @Test
    void providerFailurePropagates() {
        when(provider.embedText(anyString())).thenThrow(new ProviderException("timeout"));

        assertThrows(ProviderException.class, () -> useCase.search(PhotoQuery.ofText("sunset", null, 3)));
    }
}
