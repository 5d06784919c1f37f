package com.retailsales.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive transaction date range.
 */
@Value(staticConstructor = "of")
public class DateRange {
    LocalDate from;
    LocalDate to;
}
