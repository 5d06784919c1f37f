package com.retailsales.infrastructure.persistence.repository;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw sums from the stats aggregate. Every sum is null over an empty match.
 */
@Value(staticConstructor = "of")
public class SalesTotals {
    Long quantitySum;
    BigDecimal totalAmountSum;
    BigDecimal finalAmountSum;
}
