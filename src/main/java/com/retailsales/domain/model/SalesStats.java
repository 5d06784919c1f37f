package com.retailsales.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate statistics over the transactions matching a filter.
 *
 * totalDiscount is sum(totalAmount) - sum(finalAmount), both sums taken from
 * the same aggregate query.
 */
@Value(staticConstructor = "of")
public class SalesStats {

    long totalUnits;
    BigDecimal totalAmount;
    BigDecimal totalDiscount;

    public static SalesStats zero() {
        return of(0, SalesRecordView.money(BigDecimal.ZERO), SalesRecordView.money(BigDecimal.ZERO));
    }

    public static SalesStats fromSums(Long quantitySum, BigDecimal totalAmountSum, BigDecimal finalAmountSum) {
        BigDecimal total = SalesRecordView.money(totalAmountSum);
        BigDecimal net = SalesRecordView.money(finalAmountSum);
        return of(quantitySum == null ? 0 : quantitySum, total, total.subtract(net));
    }
}
