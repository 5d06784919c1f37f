package com.retailsales.domain.model;

import lombok.Value;

/**
 * Outcome of one ingestion run.
 *
 * Rows skipped as duplicates or dropped while mapping count in totalRecords only.
 */
@Value(staticConstructor = "of")
public class ImportSummary {
    boolean success;
    int totalRecords;
    int imported;
    int errors;
}
