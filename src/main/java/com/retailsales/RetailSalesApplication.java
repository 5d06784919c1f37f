package com.retailsales;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Retail Sales Backend
 *
 * Serves a large table of retail sales transactions.
 *
 * Architecture:
 * - REST APIs for search, filtering, sorting and offset pagination
 * - Deadline-bounded queries that degrade to empty results on timeout
 * - In-memory TTL cache for aggregate statistics
 * - Bulk CSV ingestion in sequential batches with skip-duplicates inserts
 * - Async upload processing with pollable upload records
 *
 * Resource Model:
 * - Small connection pool, so at most one query per step of a request
 * - Count query skipped when the first page is provably complete
 * - Stats computed with a single combined aggregate
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class RetailSalesApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetailSalesApplication.class, args);
    }
}
