package com.retailsales.infrastructure.persistence;

import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs storage calls on the bounded storage pool and races them against a deadline.
 *
 * Every failure leaves here as a {@link StorageAccessException} with a typed
 * {@link StorageFailure}, so callers never inspect error text. A call that
 * trips the deadline is cancelled best-effort; the statement may still finish
 * on the storage side.
 *
 * The worker pool is owned here rather than exposed as a bean, so Spring
 * Boot still configures its own task executor for {@code @Async}.
 */
@Slf4j
public class StorageDeadline implements AutoCloseable {

    private final TimeLimiter timeLimiter;
    private final ExecutorService storageExecutor;

    public StorageDeadline(TimeLimiter timeLimiter, ExecutorService storageExecutor) {
        this.timeLimiter = timeLimiter;
        this.storageExecutor = storageExecutor;
    }

    public <T> T call(String operation, Supplier<T> storageCall) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(storageCall, storageExecutor));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StorageAccessException failure = StorageAccessException.of(operation, e);
            if (failure.isTimeout()) {
                log.warn("Storage operation '{}' exceeded {} ms", operation, getTimeout().toMillis());
            }
            throw failure;
        }
    }

    public Duration getTimeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }

    @Override
    public void close() {
        storageExecutor.shutdownNow();
    }
}
