package org.learningjava.photosearch.domain.model.photo;

import java.nio.file.Path;

/**
 * Inputs of one indexing run. A blank aspect means {@value #DEFAULT_ASPECT}; a blank prompt means the
 * configured default prompt.
 */
public record IndexingRequest(
        Path rootDir,
        String aspectName,
        String prompt,
        int concurrency,
        boolean skipExisting
) {

    public static final String DEFAULT_ASPECT = "default";

    public IndexingRequest {
        aspectName = (aspectName == null || aspectName.isBlank()) ? DEFAULT_ASPECT : aspectName.trim();
        prompt = (prompt == null || prompt.isBlank()) ? null : prompt;
    }
}
