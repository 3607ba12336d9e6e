package org.learningjava.photosearch.infrastructure.adapter.in.web.admin;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress of asynchronous indexing runs, polled by clients via {@code GET /index/jobs/{id}}.
 */
@Component
public class JobRegistry {

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            int processed,
            int total,
            int succeeded,
            int failed
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public String start(String type, int total) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", 0, Math.max(total, 0), 0, 0));
        return id;
    }

    public void update(String id, int processed, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : blank(id);
            return new JobStatus(id, cur.type(), JobState.RUNNING, message != null ? message : cur.message(),
                    processed, cur.total(), cur.succeeded(), cur.failed());
        });
    }

    /** One more item finished; {@code total} may only be known once scanning is done. */
    public void itemDone(String id, int processed, int total, boolean itemSucceeded, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : blank(id);
            return new JobStatus(id, cur.type(), JobState.RUNNING, message != null ? message : cur.message(),
                    processed, Math.max(total, 0),
                    cur.succeeded() + (itemSucceeded ? 1 : 0),
                    cur.failed() + (itemSucceeded ? 0 : 1));
        });
    }

    public void done(String id, int succeeded, int failed, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : blank(id);
            int total = Math.max(cur.total(), succeeded + failed);
            return new JobStatus(id, cur.type(), JobState.DONE, message != null ? message : "Done",
                    total, total, succeeded, failed);
        });
    }

    public void fail(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : blank(id);
            return new JobStatus(id, cur.type(), JobState.FAILED, message != null ? message : "Failed",
                    cur.processed(), cur.total(), cur.succeeded(), cur.failed());
        });
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    private static JobStatus blank(String id) {
        return new JobStatus(id, "INDEX", JobState.RUNNING, "Started", 0, 0, 0, 0);
    }
}
