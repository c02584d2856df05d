package com.talent.sourcing.pipeline;

import com.talent.sourcing.SourcingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-size worker pool that maps a list of items concurrently and returns
 * the results in input order.
 */
public class BoundedExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedExecutor.class);

    private final ExecutorService executor;
    private final int parallelism;

    public BoundedExecutor(int parallelism, String threadNamePrefix) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.parallelism = parallelism;
        this.executor = Executors.newFixedThreadPool(parallelism, namedThreads(threadNamePrefix));
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Applies {@code task} to every item with at most {@link #getParallelism()} in flight.
     * Results are returned in the order of {@code items}. If any task throws, the first
     * failure in input order is rethrown after all tasks finish.
     */
    public <T, R> List<R> mapOrdered(List<T> items, Function<T, R> task) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<R>> futures = items.stream()
                .map(item -> CompletableFuture.supplyAsync(() -> task.apply(item), executor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.debug("executor.task.failed error={}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return futures.stream().map(BoundedExecutor::joinUnwrapped).toList();
    }

    private static <R> R joinUnwrapped(CompletableFuture<R> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SourcingException("Worker task failed", cause);
        }
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

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
