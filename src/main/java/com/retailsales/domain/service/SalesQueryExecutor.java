package com.retailsales.domain.service;

import com.retailsales.domain.model.PageSpec;
import com.retailsales.domain.model.SalesPage;
import com.retailsales.domain.model.SalesRecordView;
import com.retailsales.domain.model.SortSpec;
import com.retailsales.infrastructure.persistence.StorageAccessException;
import com.retailsales.infrastructure.persistence.StorageDeadline;
import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import com.retailsales.infrastructure.persistence.repository.SalesTotals;
import com.retailsales.infrastructure.persistence.repository.SalesTransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Executes built specifications against storage under the storage deadline.
 *
 * Execution Flow:
 * 1. Fetch the requested page of rows
 * 2. First page shorter than the page size: total = rows returned, no count
 * 3. Otherwise run a separate count query
 *
 * Failure Handling:
 * - Timeout on either step: degraded empty page with zero total
 * - Connectivity and other failures: propagated as StorageAccessException
 *
 * Steps run one after another so a request holds at most one connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SalesQueryExecutor {

    private final SalesTransactionRepository repository;
    private final StorageDeadline deadline;
    private final MeterRegistry meterRegistry;

    public SalesPage fetchPage(Specification<SalesTransactionEntity> spec, SortSpec sort, PageSpec pageSpec) {
        try {
            List<SalesTransactionEntity> rows = deadline.call("fetch-page",
                    () -> repository.findSlice(spec, sort.toSort(), pageSpec.getOffset(), pageSpec.getLimit()));

            long totalCount;
            if (pageSpec.isFirstPage() && rows.size() < pageSpec.getLimit()) {
                totalCount = rows.size();
            } else {
                totalCount = deadline.call("count", () -> repository.count(spec));
            }

            List<SalesRecordView> records = rows.stream()
                    .map(SalesRecordView::from)
                    .toList();

            return SalesPage.of(records, pageSpec, totalCount);

        } catch (StorageAccessException e) {
            if (!e.isTimeout()) {
                throw e;
            }
            log.warn("Sales query timed out during '{}', returning empty page {}", e.getOperation(), pageSpec.getPage());
            degraded("page");
            return SalesPage.empty(pageSpec);
        }
    }

    /**
     * Single-pass sums over matching rows.
     *
     * @return the sums, or empty when the aggregate timed out
     */
    public Optional<SalesTotals> sumTotals(Specification<SalesTransactionEntity> spec) {
        try {
            return Optional.of(deadline.call("sum-totals", () -> repository.sumTotals(spec)));
        } catch (StorageAccessException e) {
            if (!e.isTimeout()) {
                throw e;
            }
            log.warn("Stats aggregate timed out, returning zero totals");
            degraded("stats");
            return Optional.empty();
        }
    }

    private void degraded(String type) {
        Counter.builder("query.degraded")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }
}
