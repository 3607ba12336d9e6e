package org.learningjava.photosearch.application.usecase;

import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.learningjava.photosearch.domain.model.photo.DeleteOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexTask;
import org.learningjava.photosearch.domain.model.photo.IndexingRequest;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.learningjava.photosearch.domain.service.embedding.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

@Service
public class ManagePhotosUseCase {
    private static final Logger log = LoggerFactory.getLogger(ManagePhotosUseCase.class);

    private final PhotoIndexer indexer;
    private final AspectIndexPort index;
    private final EmbeddingProvider provider;

    public ManagePhotosUseCase(PhotoIndexer indexer, AspectIndexPort index, EmbeddingProvider provider) {
        this.indexer = indexer;
        this.index = index;
        this.provider = provider;
    }

    /** Describes and stores one photo under one aspect, replacing any previous record for that key. */
    public IndexOutcome indexPhoto(Path photo, String aspectName, String prompt) {
        if (photo == null) throw new QueryValidationException("photo path is required");
        String aspect = (aspectName == null || aspectName.isBlank()) ? IndexingRequest.DEFAULT_ASPECT : aspectName.trim();
        String effectivePrompt = (prompt == null || prompt.isBlank()) ? null : prompt;
        return indexer.index(new IndexTask(photo, aspect, effectivePrompt, false));
    }

    public DeleteOutcome deletePhoto(String photoPath, String aspectName) {
        if (photoPath == null || photoPath.isBlank()) throw new QueryValidationException("photo path is required");
        String aspect = (aspectName == null || aspectName.isBlank()) ? null : aspectName.trim();
        String key = key(photoPath);
        int deleted = index.delete(key, aspect);
        DeleteOutcome outcome = new DeleteOutcome(key, aspect, deleted);
        log.info(outcome.message());
        return outcome;
    }

    public Set<String> listPhotoPaths() {
        return index.listPhotoPaths();
    }

    public List<PhotoRecord> aspectsOf(String photoPath) {
        if (photoPath == null || photoPath.isBlank()) throw new QueryValidationException("photo path is required");
        return index.findByPhoto(key(photoPath));
    }

    public long count() {
        return index.count();
    }

    public void clear() {
        log.warn("Clearing the aspect index ({} records)", index.count());
        index.clear();
    }

    public List<String> listAvailableModels() {
        return provider.listAvailableModels();
    }

    /** Parses a client-supplied path; a malformed one is a validation failure. */
    public static Path parsePath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new QueryValidationException("Invalid path: " + raw);
        }
    }

    // same key form the indexer stores
    private static String key(String photoPath) {
        return IndexTask.keyOf(parsePath(photoPath));
    }
}
