package com.retailsales.infrastructure.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic removal of expired cache entries.
 *
 * Runs every 5 minutes by default (app.cache.sweep-interval-ms).
 * Disabled with app.cache.sweep-enabled=false, e.g. in tests or batch tools
 * that run without a scheduler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cache.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class CacheSweeper {

    private final TtlCache cache;

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:300000}",
               initialDelayString = "${app.cache.sweep-interval-ms:300000}")
    public void sweepExpiredEntries() {
        int removed = cache.sweep();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries, {} remaining", removed, cache.size());
        }
    }
}
