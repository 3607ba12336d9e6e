package org.learningjava.photosearch.domain.model.photo;

import java.time.Duration;
import java.util.List;

public record IndexingReport(
        String rootDir,
        String aspectName,
        int total,
        int succeeded,
        int skipped,
        int failed,
        List<IndexOutcome> outcomes,
        Duration elapsed
) {

    public static IndexingReport of(String rootDir, String aspectName, List<IndexOutcome> outcomes, Duration elapsed) {
        int ok = 0, skip = 0, err = 0;
        for (IndexOutcome o : outcomes) {
            if (o.kind() == IndexOutcome.Kind.SKIPPED) skip++;
            if (o.success()) ok++;
            else err++;
        }
        return new IndexingReport(rootDir, aspectName, outcomes.size(), ok, skip, err, List.copyOf(outcomes), elapsed);
    }
}
