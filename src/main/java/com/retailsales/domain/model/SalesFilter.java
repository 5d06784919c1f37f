package com.retailsales.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * Conjunctive filter over sales transactions.
 *
 * Sub-filters combine with AND. Values inside one multi-select set combine
 * with OR. An empty set means the sub-filter is absent; ranges are absent
 * when not set.
 */
@Value
@Builder(toBuilder = true)
public class SalesFilter {

    @Singular
    Set<String> regions;

    @Singular
    Set<String> genders;

    @Singular
    Set<String> categories;

    @Singular
    Set<String> paymentMethods;

    @Singular
    Set<String> tags;

    AgeRange ageRange;

    DateRange dateRange;

    public static SalesFilter none() {
        return SalesFilter.builder().build();
    }

    public Optional<AgeRange> getAgeRange() {
        return Optional.ofNullable(ageRange);
    }

    public Optional<DateRange> getDateRange() {
        return Optional.ofNullable(dateRange);
    }
}
