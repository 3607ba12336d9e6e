package org.learningjava.photosearch.infrastructure.adapter.out.fs;

import org.learningjava.photosearch.application.port.PhotoSourcePort;
import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.error.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class FileSystemPhotoScanner implements PhotoSourcePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPhotoScanner.class);

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg");

    @Override
    public List<Path> discoverPhotos(Path rootDir) {
        if (rootDir == null || !Files.isDirectory(rootDir)) {
            throw new QueryValidationException("Directory not found: " + rootDir);
        }
        try (var s = Files.walk(rootDir)) {
            List<Path> photos = s.filter(Files::isRegularFile)
                    .filter(FileSystemPhotoScanner::isImage)
                    .sorted()
                    .toList();
            if (photos.isEmpty()) {
                log.warn("No images found under: {}", rootDir);
            } else {
                log.info("Total images found under {}: {}", rootDir, photos.size());
            }
            return photos;
        } catch (IOException | UncheckedIOException e) {
            throw new QueryValidationException("Cannot scan " + rootDir + ": " + e.getMessage());
        }
    }

    @Override
    public byte[] read(Path photo) {
        try {
            return Files.readAllBytes(photo);
        } catch (IOException e) {
            throw new ImageReadException("Cannot read image " + photo + ": " + e.getMessage(), e);
        }
    }

    static boolean isImage(Path p) {
        String name = p.getFileName().toString();
        int i = name.lastIndexOf('.');
        if (i <= 0 || i == name.length() - 1) return false;
        return IMAGE_EXTENSIONS.contains(name.substring(i + 1).toLowerCase(Locale.ROOT));
    }
}
