package com.retailsales.domain.model;

import lombok.Value;

/**
 * Cumulative ingestion counters, emitted after each batch.
 */
@Value(staticConstructor = "of")
public class ImportProgress {
    int processed;
    int total;
    int imported;
    int errors;
}
