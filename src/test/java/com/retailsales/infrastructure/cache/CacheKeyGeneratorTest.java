package com.retailsales.infrastructure.cache;

import com.retailsales.domain.model.AgeRange;
import com.retailsales.domain.model.DateRange;
import com.retailsales.domain.model.SalesFilter;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyGeneratorTest {

    private final CacheKeyGenerator keyGenerator = new CacheKeyGenerator();

    @Test
    void testGenerateKey_IgnoresSelectionOrder() {
        SalesFilter first = SalesFilter.builder()
                .region("North").region("East").region("West")
                .tag("vip").tag("new")
                .ageRange(AgeRange.of(18, 25))
                .build();
        SalesFilter second = SalesFilter.builder()
                .tag("new").tag("vip")
                .region("West").region("North").region("East")
                .ageRange(AgeRange.of(18, 25))
                .build();

        assertEquals(keyGenerator.generateKey("stats", first), keyGenerator.generateKey("stats", second));
    }

    @Test
    void testGenerateKey_DifferentFiltersDiffer() {
        SalesFilter north = SalesFilter.builder().region("North").build();
        SalesFilter south = SalesFilter.builder().region("South").build();
        SalesFilter northAged = north.toBuilder().ageRange(AgeRange.of(18, 25)).build();

        String northKey = keyGenerator.generateKey("stats", north);

        assertNotEquals(northKey, keyGenerator.generateKey("stats", south));
        assertNotEquals(northKey, keyGenerator.generateKey("stats", northAged));
    }

    @Test
    void testGenerateKey_NamespacePrefix() {
        String key = keyGenerator.generateKey("stats", SalesFilter.builder()
                .dateRange(DateRange.of(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31)))
                .build());

        assertTrue(key.startsWith("stats:"));
        assertTrue(key.contains("2023-01-01"));
    }

    @Test
    void testGenerateKey_EmptyFilterMatchesNull() {
        assertEquals(keyGenerator.generateKey("stats", null),
                keyGenerator.generateKey("stats", SalesFilter.none()));
    }
}
