package org.learningjava.photosearch.domain.model.photo;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Primary key of a {@link PhotoRecord}: a name-based UUID over
 * {@code <length of photoPath>:photoPath|aspectName}. The length prefix keeps a {@code |}
 * inside either part from aliasing another key.
 */
public record EntryId(String value) {

    public static EntryId of(String photoPath, String aspectName) {
        if (photoPath == null || aspectName == null) {
            throw new IllegalArgumentException("photoPath and aspectName are required");
        }
        String composite = photoPath.length() + ":" + photoPath + "|" + aspectName;
        return new EntryId(UUID.nameUUIDFromBytes(composite.getBytes(StandardCharsets.UTF_8)).toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
