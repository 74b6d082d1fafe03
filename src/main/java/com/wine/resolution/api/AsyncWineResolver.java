package com.wine.resolution.api;

import com.wine.resolution.core.model.UnresolvedWineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs query-path resolutions on a fixed pool. Each call is bounded by the configured timeout
 * and fails with a {@link java.util.concurrent.TimeoutException} when it runs over.
 * Catalog ingestion never goes through here: it must stay sequential.
 */
public class AsyncWineResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncWineResolver.class);

    private final WineResolutionService service;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncWineResolver(WineResolutionService service, ResolutionOptions options) {
        this.service = service;
        this.timeoutMs = options.getAsyncTimeoutMs();
        this.executor = Executors.newFixedThreadPool(options.getAsyncThreads(), new ResolverThreadFactory());
        log.debug("AsyncWineResolver started: threads={}, timeoutMs={}", options.getAsyncThreads(), timeoutMs);
    }

    public CompletableFuture<ResolutionResult> resolveAsync(UnresolvedWineRecord unresolved) {
        return CompletableFuture.supplyAsync(() -> service.resolveWithDetails(unresolved), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Resolves every record; results keep the input order.
     */
    public CompletableFuture<List<ResolutionResult>> resolveAll(List<UnresolvedWineRecord> records) {
        List<CompletableFuture<ResolutionResult>> futures = records.stream()
                .map(this::resolveAsync)
                .toList();
        return joinAll(futures);
    }

    /**
     * Like {@link #resolveAll(List)} with at most {@code maxConcurrency} resolutions running at once.
     */
    public CompletableFuture<List<ResolutionResult>> resolveAll(List<UnresolvedWineRecord> records,
                                                                int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        Semaphore semaphore = new Semaphore(maxConcurrency);

        List<CompletableFuture<ResolutionResult>> futures = records.stream()
                .map(record -> CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return service.resolveWithDetails(record);
                    } finally {
                        semaphore.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .toList();
        return joinAll(futures);
    }

    private static CompletableFuture<List<ResolutionResult>> joinAll(List<CompletableFuture<ResolutionResult>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class ResolverThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "wine-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
