package com.retailsales.domain.service;

import com.retailsales.domain.model.PageSpec;
import com.retailsales.domain.model.SalesPage;
import com.retailsales.domain.model.SortSpec;
import com.retailsales.infrastructure.persistence.StorageAccessException;
import com.retailsales.infrastructure.persistence.StorageDeadline;
import com.retailsales.infrastructure.persistence.StorageFailure;
import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import com.retailsales.infrastructure.persistence.repository.SalesTotals;
import com.retailsales.infrastructure.persistence.repository.SalesTransactionRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SalesQueryExecutorTest {

    @Mock
    private SalesTransactionRepository repository;

    private MeterRegistry meterRegistry;
    private StorageDeadline deadline;
    private SalesQueryExecutor executor;

    private final Specification<SalesTransactionEntity> spec = SalesPredicateBuilder.matchAll();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        TimeLimiter timeLimiter = TimeLimiter.of("test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .build());
        deadline = new StorageDeadline(timeLimiter, Executors.newFixedThreadPool(2));
        executor = new SalesQueryExecutor(repository, deadline, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        deadline.close();
    }

    @Test
    void testFetchPage_ShortFirstPageSkipsCount() {
        // Given
        when(repository.findSlice(any(), any(), eq(0), eq(10))).thenReturn(createRows(3));

        // When
        SalesPage page = executor.fetchPage(spec, SortSpec.DEFAULT, PageSpec.of(1, 10));

        // Then
        assertEquals(3, page.getRecords().size());
        assertEquals(3, page.getPagination().getTotalCount());
        assertEquals(1, page.getPagination().getTotalPages());
        verify(repository, never()).count(any(Specification.class));
    }

    @Test
    void testFetchPage_FullPageRunsCount() {
        // Given
        when(repository.findSlice(any(), any(), eq(10), eq(10))).thenReturn(createRows(10));
        when(repository.count(any(Specification.class))).thenReturn(35L);

        // When
        SalesPage page = executor.fetchPage(spec, SortSpec.DEFAULT, PageSpec.of(2, 10));

        // Then
        assertEquals(10, page.getRecords().size());
        assertEquals(35L, page.getPagination().getTotalCount());
        assertEquals(4, page.getPagination().getTotalPages());
    }

    @Test
    void testFetchPage_TimeoutDegradesToEmptyPage() {
        // Given
        when(repository.findSlice(any(), any(), anyInt(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return createRows(10);
        });

        // When
        SalesPage page = executor.fetchPage(spec, SortSpec.DEFAULT, PageSpec.of(1, 10));

        // Then
        assertTrue(page.getRecords().isEmpty());
        assertEquals(0, page.getPagination().getTotalCount());
        assertEquals(1.0, meterRegistry.counter("query.degraded", "type", "page").count());
    }

    @Test
    void testFetchPage_CountTimeoutDegradesToEmptyPage() {
        when(repository.findSlice(any(), any(), anyInt(), anyInt())).thenReturn(createRows(10));
        when(repository.count(any(Specification.class))).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return 100L;
        });

        SalesPage page = executor.fetchPage(spec, SortSpec.DEFAULT, PageSpec.of(1, 10));

        assertTrue(page.getRecords().isEmpty());
        assertEquals(0, page.getPagination().getTotalCount());
    }

    @Test
    void testFetchPage_ConnectivityPropagates() {
        when(repository.findSlice(any(), any(), anyInt(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        StorageAccessException e = assertThrows(StorageAccessException.class,
                () -> executor.fetchPage(spec, SortSpec.DEFAULT, PageSpec.of(1, 10)));

        assertEquals(StorageFailure.CONNECTIVITY, e.getFailure());
    }

    @Test
    void testSumTotals_TimeoutIsEmpty() {
        when(repository.sumTotals(any())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return SalesTotals.of(1L, BigDecimal.ONE, BigDecimal.ONE);
        });

        Optional<SalesTotals> totals = executor.sumTotals(spec);

        assertTrue(totals.isEmpty());
    }

    @Test
    void testSumTotals_ReturnsSums() {
        SalesTotals expected = SalesTotals.of(12L, new BigDecimal("300.00"), new BigDecimal("270.00"));
        when(repository.sumTotals(any())).thenReturn(expected);

        assertEquals(Optional.of(expected), executor.sumTotals(spec));
    }

    private List<SalesTransactionEntity> createRows(int count) {
        List<SalesTransactionEntity> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(SalesTransactionEntity.builder()
                    .transactionId("T" + i)
                    .transactionDate(LocalDate.of(2023, 1, 1))
                    .customerName("Customer " + i)
                    .quantity(i)
                    .pricePerUnit(new BigDecimal("10"))
                    .discountPercentage(BigDecimal.ZERO)
                    .totalAmount(new BigDecimal("10"))
                    .finalAmount(new BigDecimal("10"))
                    .build());
        }
        return rows;
    }
}
