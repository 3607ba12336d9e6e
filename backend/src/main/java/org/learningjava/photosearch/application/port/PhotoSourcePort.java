package org.learningjava.photosearch.application.port;

import java.nio.file.Path;
import java.util.List;

public interface PhotoSourcePort {
    List<Path> discoverPhotos(Path rootDir); // recursive, recognized image extensions only

    byte[] read(Path photo);
}
