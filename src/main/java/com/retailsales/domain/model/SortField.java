package com.retailsales.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sortable fields, keyed by their request parameter name.
 */
public enum SortField {
    DATE("date", "transactionDate"),
    QUANTITY("quantity", "quantity"),
    CUSTOMER_NAME("customerName", "customerName");

    private final String paramName;
    private final String attribute;

    SortField(String paramName, String attribute) {
        this.paramName = paramName;
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }

    public static Optional<SortField> fromParam(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.paramName.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
