package com.retailsales.config;

import com.retailsales.infrastructure.persistence.StorageDeadline;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Storage access wiring.
 *
 * The worker pool stays small: the connection pool behind it is small too,
 * and a request never issues more than one storage call at a time.
 */
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public StorageDeadline storageDeadline(@Value("${app.query.timeout-seconds:15}") long timeoutSeconds,
                                           @Value("${app.storage.worker-threads:4}") int workerThreads) {
        TimeLimiter timeLimiter = TimeLimiter.of("storage", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(timeoutSeconds))
                .cancelRunningFuture(true)
                .build());

        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "storage-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };

        return new StorageDeadline(timeLimiter, Executors.newFixedThreadPool(workerThreads, threadFactory));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
