package com.retailsales.domain.service;

import com.retailsales.domain.model.AgeRange;
import com.retailsales.domain.model.FilterOptions;
import com.retailsales.domain.model.SalesPage;
import com.retailsales.domain.model.SalesQueryRequest;
import com.retailsales.infrastructure.cache.TtlCache;
import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import com.retailsales.infrastructure.persistence.repository.SalesTransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Query service for sales transactions.
 *
 * Query Flow:
 * 1. Build a specification from filters and search term
 * 2. Execute it under the storage deadline (page fetch, count only if needed)
 * 3. Return records with pagination metadata
 *
 * Page queries are not cached; filter options are, since they only change
 * when an ingestion runs and the ingestion clears the cache.
 */
@Slf4j
@Service
public class SalesQueryService {

    static final String FILTER_OPTIONS_KEY = "filter-options";

    private static final int DEFAULT_MIN_AGE = 0;
    private static final int DEFAULT_MAX_AGE = 100;

    private final SalesPredicateBuilder predicateBuilder;
    private final SalesQueryExecutor queryExecutor;
    private final SalesTransactionRepository repository;
    private final TtlCache cache;
    private final MeterRegistry meterRegistry;
    private final Duration filterOptionsTtl;

    public SalesQueryService(SalesPredicateBuilder predicateBuilder,
                             SalesQueryExecutor queryExecutor,
                             SalesTransactionRepository repository,
                             TtlCache cache,
                             MeterRegistry meterRegistry,
                             @Value("${app.cache.filter-options-ttl-seconds:300}") long filterOptionsTtlSeconds) {
        this.predicateBuilder = predicateBuilder;
        this.queryExecutor = queryExecutor;
        this.repository = repository;
        this.cache = cache;
        this.meterRegistry = meterRegistry;
        this.filterOptionsTtl = Duration.ofSeconds(filterOptionsTtlSeconds);
    }

    /**
     * Search, filter, sort and page sales transactions.
     *
     * Timeouts come back as an empty page; other storage failures propagate.
     */
    public SalesPage queryTransactions(SalesQueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        Specification<SalesTransactionEntity> spec =
                predicateBuilder.build(request.getFilter(), request.getSearch());

        SalesPage page = queryExecutor.fetchPage(spec, request.getSort(), request.getPageSpec());

        long queryTime = System.currentTimeMillis() - startTime;
        page.setQueryTimeMs(queryTime);

        sample.stop(Timer.builder("query.latency")
                .tag("type", "transactions")
                .register(meterRegistry));

        Counter.builder("query.executed")
                .tag("type", "transactions")
                .register(meterRegistry)
                .increment();

        log.info("Query executed: page {} ({} records of {}), {} ms",
                page.getPagination().getPage(), page.getRecords().size(),
                page.getPagination().getTotalCount(), queryTime);

        return page;
    }

    /**
     * Distinct values for filter controls.
     *
     * Queries run sequentially to keep connection usage at one.
     */
    public FilterOptions getFilterOptions() {
        Optional<FilterOptions> cached = cache.get(FILTER_OPTIONS_KEY, FilterOptions.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        SalesTransactionRepository.AgeBounds bounds = repository.findAgeBounds();
        int minAge = bounds != null && bounds.getMinAge() != null ? bounds.getMinAge() : DEFAULT_MIN_AGE;
        int maxAge = bounds != null && bounds.getMaxAge() != null ? bounds.getMaxAge() : DEFAULT_MAX_AGE;

        FilterOptions options = FilterOptions.builder()
                .regions(repository.findDistinctRegions())
                .genders(repository.findDistinctGenders())
                .categories(repository.findDistinctCategories())
                .paymentMethods(repository.findDistinctPaymentMethods())
                .ageRange(AgeRange.of(minAge, maxAge))
                .tags(splitTags(repository.findDistinctTagLists()))
                .build();

        cache.set(FILTER_OPTIONS_KEY, options, filterOptionsTtl);

        log.info("Filter options loaded: {} regions, {} categories, {} tags",
                options.getRegions().size(), options.getCategories().size(), options.getTags().size());

        return options;
    }

    static List<String> splitTags(List<String> tagLists) {
        TreeSet<String> tags = new TreeSet<>();
        for (String tagList : tagLists) {
            if (tagList == null) {
                continue;
            }
            Arrays.stream(tagList.split(","))
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .forEach(tags::add);
        }
        return new ArrayList<>(tags);
    }
}
