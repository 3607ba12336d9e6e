package org.learningjava.photosearch.application.port;

import org.learningjava.photosearch.domain.model.photo.CanonicalImage;

public interface ImageDescriptionPort {
    String describe(CanonicalImage image, String prompt);
    String model();
}
