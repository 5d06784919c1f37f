package com.retailsales.domain.service;

import com.retailsales.domain.model.SalesFilter;
import com.retailsales.domain.model.SalesStats;
import com.retailsales.infrastructure.cache.CacheKeyGenerator;
import com.retailsales.infrastructure.cache.MutableClock;
import com.retailsales.infrastructure.cache.TtlCache;
import com.retailsales.infrastructure.persistence.repository.SalesTotals;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SalesStatsService.
 *
 * Uses a real cache on a controllable clock so expiry is observable.
 */
@ExtendWith(MockitoExtension.class)
class SalesStatsServiceTest {

    @Mock
    private SalesQueryExecutor queryExecutor;

    private MutableClock clock;
    private TtlCache cache;
    private MeterRegistry meterRegistry;
    private SalesStatsService statsService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new TtlCache(clock);
        meterRegistry = new SimpleMeterRegistry();
        statsService = new SalesStatsService(new SalesPredicateBuilder(), queryExecutor, cache,
                new CacheKeyGenerator(), meterRegistry, 30);
    }

    @Test
    void testGetStats_DiscountIsGrossMinusNet() {
        // Given
        when(queryExecutor.sumTotals(any()))
                .thenReturn(Optional.of(SalesTotals.of(12L, new BigDecimal("300.5"), new BigDecimal("270.25"))));

        // When
        SalesStats stats = statsService.getStats(SalesFilter.none());

        // Then
        assertEquals(12, stats.getTotalUnits());
        assertEquals(new BigDecimal("300.50"), stats.getTotalAmount());
        assertEquals(new BigDecimal("30.25"), stats.getTotalDiscount());
    }

    @Test
    void testGetStats_CacheHitSkipsStorage() {
        // Given
        when(queryExecutor.sumTotals(any()))
                .thenReturn(Optional.of(SalesTotals.of(1L, BigDecimal.TEN, BigDecimal.ONE)));
        SalesFilter first = SalesFilter.builder().region("North").region("East").build();
        SalesFilter reordered = SalesFilter.builder().region("East").region("North").build();

        // When
        SalesStats computed = statsService.getStats(first);
        clock.advance(Duration.ofSeconds(29));
        SalesStats cached = statsService.getStats(reordered);

        // Then
        assertEquals(computed, cached);
        verify(queryExecutor, times(1)).sumTotals(any());
        assertEquals(1.0, meterRegistry.counter("query.cache", "result", "hit", "type", "stats").count());
    }

    @Test
    void testGetStats_RecomputedAfterTtl() {
        when(queryExecutor.sumTotals(any()))
                .thenReturn(Optional.of(SalesTotals.of(1L, BigDecimal.TEN, BigDecimal.ONE)));

        statsService.getStats(SalesFilter.none());
        clock.advance(Duration.ofSeconds(31));
        statsService.getStats(SalesFilter.none());

        verify(queryExecutor, times(2)).sumTotals(any());
    }

    @Test
    void testGetStats_TimeoutReturnsZerosNotCached() {
        // Given
        when(queryExecutor.sumTotals(any())).thenReturn(Optional.empty());

        // When
        SalesStats stats = statsService.getStats(SalesFilter.none());

        // Then
        assertEquals(SalesStats.zero(), stats);
        assertEquals(0, cache.size());
    }

    @Test
    void testGetStats_NoMatchingRowsIsZero() {
        when(queryExecutor.sumTotals(any())).thenReturn(Optional.of(SalesTotals.of(null, null, null)));

        SalesStats stats = statsService.getStats(SalesFilter.builder().region("Nowhere").build());

        assertEquals(0, stats.getTotalUnits());
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getTotalDiscount()));
    }
}
