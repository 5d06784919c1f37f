package com.retailsales.domain.service;

import com.retailsales.domain.model.SalesFilter;
import com.retailsales.domain.model.SalesStats;
import com.retailsales.infrastructure.cache.CacheKeyGenerator;
import com.retailsales.infrastructure.cache.TtlCache;
import com.retailsales.infrastructure.persistence.repository.SalesTotals;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Aggregate statistics (units, gross amount, discount) for a filter.
 *
 * Caching Strategy:
 * - Key: "stats:" + canonical JSON of the filter (sets sorted)
 * - Hit: returned without touching storage
 * - Miss: one combined aggregate query, cached for 30 seconds
 * - Timeout: zeros, not cached
 *
 * The search term never applies to stats.
 */
@Slf4j
@Service
public class SalesStatsService {

    static final String STATS_NAMESPACE = "stats";

    private final SalesPredicateBuilder predicateBuilder;
    private final SalesQueryExecutor queryExecutor;
    private final TtlCache cache;
    private final CacheKeyGenerator keyGenerator;
    private final MeterRegistry meterRegistry;
    private final Duration statsTtl;

    public SalesStatsService(SalesPredicateBuilder predicateBuilder,
                             SalesQueryExecutor queryExecutor,
                             TtlCache cache,
                             CacheKeyGenerator keyGenerator,
                             MeterRegistry meterRegistry,
                             @Value("${app.cache.stats-ttl-seconds:30}") long statsTtlSeconds) {
        this.predicateBuilder = predicateBuilder;
        this.queryExecutor = queryExecutor;
        this.cache = cache;
        this.keyGenerator = keyGenerator;
        this.meterRegistry = meterRegistry;
        this.statsTtl = Duration.ofSeconds(statsTtlSeconds);
    }

    public SalesStats getStats(SalesFilter filter) {
        SalesFilter effective = filter == null ? SalesFilter.none() : filter;
        String cacheKey = keyGenerator.generateKey(STATS_NAMESPACE, effective);

        Optional<SalesStats> cached = cache.get(cacheKey, SalesStats.class);
        if (cached.isPresent()) {
            Counter.builder("query.cache")
                    .tag("result", "hit")
                    .tag("type", "stats")
                    .register(meterRegistry)
                    .increment();
            return cached.get();
        }

        Counter.builder("query.cache")
                .tag("result", "miss")
                .tag("type", "stats")
                .register(meterRegistry)
                .increment();

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        Optional<SalesTotals> totals = queryExecutor.sumTotals(predicateBuilder.build(effective));
        if (totals.isEmpty()) {
            return SalesStats.zero();
        }

        SalesStats stats = SalesStats.fromSums(
                totals.get().getQuantitySum(),
                totals.get().getTotalAmountSum(),
                totals.get().getFinalAmountSum());

        cache.set(cacheKey, stats, statsTtl);

        sample.stop(Timer.builder("query.latency")
                .tag("type", "stats")
                .register(meterRegistry));

        log.info("Stats aggregate executed: {} units, {} ms", stats.getTotalUnits(),
                System.currentTimeMillis() - startTime);

        return stats;
    }
}
