package org.learningjava.photosearch.infrastructure.adapter.in.web.admin;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.photosearch.application.usecase.IndexPhotosUseCase;
import org.learningjava.photosearch.application.usecase.ManagePhotosUseCase;
import org.learningjava.photosearch.config.PhotoSearchProperties;
import org.learningjava.photosearch.domain.model.photo.IndexingReport;
import org.learningjava.photosearch.domain.model.photo.IndexingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/index")
public class IndexingController {

    private static final Logger log = LoggerFactory.getLogger(IndexingController.class);

    private final IndexPhotosUseCase indexing;
    private final JobRegistry jobs;
    private final Executor executor;
    private final PhotoSearchProperties props;

    public IndexingController(IndexPhotosUseCase indexing,
                              JobRegistry jobs,
                              @Qualifier("applicationTaskExecutor") Executor executor,
                              PhotoSearchProperties props) {
        this.indexing = indexing;
        this.jobs = jobs;
        this.executor = executor;
        this.props = props;
    }

    // --- Index a server/container directory; runs in the background, poll /index/jobs/{id}
    @PostMapping
    public Map<String, Object> indexDirectory(@Valid @RequestBody IndexRequest req) {
        Path dir = ManagePhotosUseCase.parsePath(req.rootDir());
        if (!Files.isDirectory(dir)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Directory not found: " + req.rootDir());
        }
        int concurrency = req.concurrency() != null ? req.concurrency() : props.getIndexing().getConcurrency();
        if (concurrency < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "concurrency must be >= 1");
        }
        boolean skip = req.skipExisting() != null ? req.skipExisting() : props.getIndexing().isSkipExisting();
        IndexingRequest request = new IndexingRequest(dir, req.aspect(), req.prompt(), concurrency, skip);

        String jobId = jobs.start("INDEX", 0);
        jobs.update(jobId, 0, "Scanning: " + dir);

        try {
            executor.execute(() -> runJob(jobId, dir, request));
        } catch (RejectedExecutionException e) {
            // launcher queue is full; the job never started
            jobs.fail(jobId, "Too many indexing runs in progress");
            log.warn("[{}] Indexing rejected: {}", jobId, e.toString());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Too many indexing runs in progress, retry later", e);
        }

        return Map.of("jobId", jobId);
    }

    private void runJob(String jobId, Path dir, IndexingRequest request) {
        try {
            log.info("[{}] Indexing start: {} [{}]", jobId, dir, request.aspectName());
            IndexingReport report = indexing.run(request, (outcome, processed, total) ->
                    jobs.itemDone(jobId, processed, total, outcome.success(), outcome.message()));

            jobs.done(jobId, report.succeeded(), report.failed(),
                    "Processed " + report.total() + " images: " + report.succeeded()
                            + " succeeded, " + report.failed() + " errors");
            log.info("[{}] Indexing done: {} ok, {} errors", jobId, report.succeeded(), report.failed());
        } catch (Exception e) {
            jobs.fail(jobId, e.getMessage());
            log.error("[{}] Indexing failed: {}", jobId, e.toString(), e);
        }
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        }
        return status;
    }

    public record IndexRequest(
            @NotBlank String rootDir,
            String aspect,
            String prompt,
            Integer concurrency,
            Boolean skipExisting
    ) {}
}
