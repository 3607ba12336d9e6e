package org.learningjava.photosearch.application.usecase;

import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexTask;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.function.Function;

/**
 * Fixed-size worker pool that lives for one indexing run. Outcomes are delivered in completion order.
 */
class IndexingWorkerPool implements AutoCloseable {

    private final ThreadPoolTaskExecutor executor;
    private final CompletionService<IndexOutcome> completions;
    private final Function<IndexTask, IndexOutcome> worker;

    IndexingWorkerPool(int size, Function<IndexTask, IndexOutcome> worker) {
        if (size < 1) throw new IllegalArgumentException("pool size must be >= 1, got " + size);
        this.worker = worker;
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("indexer-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        this.completions = new ExecutorCompletionService<>(executor);
    }

    void submit(IndexTask task) {
        completions.submit(() -> {
            try {
                return worker.apply(task);
            } catch (RuntimeException e) {
                return IndexOutcome.failed(task.photoPath(), task.aspectName(),
                        IndexOutcome.Kind.INTERNAL_ERROR, String.valueOf(e));
            }
        });
    }

    /** Blocks until the next submitted task finishes. */
    IndexOutcome take() throws InterruptedException {
        try {
            return completions.take().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Indexing worker died", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
