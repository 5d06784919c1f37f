package com.retailsales.domain.ingest;

import com.retailsales.domain.model.ImportProgress;
import com.retailsales.domain.model.ImportProgressListener;
import com.retailsales.domain.model.ImportSummary;
import com.retailsales.infrastructure.cache.TtlCache;
import com.retailsales.infrastructure.persistence.StorageAccessException;
import com.retailsales.infrastructure.persistence.StorageFailure;
import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import com.retailsales.infrastructure.persistence.repository.SalesBatchWriter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV ingestion pipeline.
 *
 * Pipeline:
 * 1. Parse the whole input (malformed input fails before anything is written)
 * 2. Map and insert rows in sequential batches, skipping duplicate transaction ids
 * 3. Report cumulative progress after every batch
 * 4. Clear the read cache once writing has started, whatever the outcome
 *
 * Failure Handling:
 * - Unmappable row: dropped, counted in the total only
 * - Batch insert failure: whole batch counted as errors, next batch continues
 * - Lost storage connectivity: import aborts with StorageAccessException
 */
@Slf4j
@Service
public class SalesImportService {

    private final SalesCsvParser parser;
    private final SalesRowMapper rowMapper;
    private final SalesBatchWriter batchWriter;
    private final TtlCache cache;
    private final MeterRegistry meterRegistry;
    private final int batchSize;

    public SalesImportService(SalesCsvParser parser,
                              SalesRowMapper rowMapper,
                              SalesBatchWriter batchWriter,
                              TtlCache cache,
                              MeterRegistry meterRegistry,
                              @Value("${app.import.batch-size:1000}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("app.import.batch-size must be positive: " + batchSize);
        }
        this.parser = parser;
        this.rowMapper = rowMapper;
        this.batchWriter = batchWriter;
        this.cache = cache;
        this.meterRegistry = meterRegistry;
        this.batchSize = batchSize;
    }

    public ImportSummary importBuffer(byte[] content, ImportProgressListener listener) {
        return importStream(new ByteArrayInputStream(content), listener);
    }

    public ImportSummary importFile(Path path, ImportProgressListener listener) {
        try (InputStream input = Files.newInputStream(path)) {
            return importStream(input, listener);
        } catch (IOException e) {
            throw new CsvImportException("Cannot read CSV file " + path + ": " + e.getMessage(), e);
        }
    }

    public ImportSummary importStream(InputStream input, ImportProgressListener listener) {
        return run(parser.parse(input), listener == null ? ImportProgressListener.NONE : listener);
    }

    private ImportSummary run(ParsedCsv csv, ImportProgressListener listener) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        List<CSVRecord> records = csv.getRecords();
        int total = records.size();
        int imported = 0;
        int errors = 0;
        int dropped = 0;

        try {
            for (int start = 0; start < total; start += batchSize) {
                int end = Math.min(start + batchSize, total);
                List<SalesTransactionEntity> rows = new ArrayList<>(end - start);

                for (CSVRecord record : records.subList(start, end)) {
                    try {
                        rows.add(rowMapper.map(record, csv.getColumns()));
                    } catch (RuntimeException e) {
                        log.warn("Dropping CSV record {}: {}", record.getRecordNumber(), e.getMessage());
                        dropped++;
                    }
                }

                try {
                    imported += batchWriter.insertSkippingDuplicates(rows);
                } catch (RuntimeException e) {
                    if (StorageFailure.classify(e) == StorageFailure.CONNECTIVITY) {
                        throw StorageAccessException.of("insert-batch", e);
                    }
                    log.error("Batch of records {}-{} failed: {}", start + 1, end, e.getMessage(), e);
                    errors += end - start;
                }

                notifyProgress(listener, ImportProgress.of(end, total, imported, errors));
            }
        } finally {
            cache.clear();
        }

        sample.stop(Timer.builder("import.latency").register(meterRegistry));
        Counter.builder("import.records").tag("result", "imported").register(meterRegistry).increment(imported);
        Counter.builder("import.records").tag("result", "failed").register(meterRegistry).increment(errors);
        Counter.builder("import.records").tag("result", "dropped").register(meterRegistry).increment(dropped);

        log.info("CSV import finished: {} records, {} imported, {} errors, {} dropped, {} ms",
                total, imported, errors, dropped, System.currentTimeMillis() - startTime);

        return ImportSummary.of(true, total, imported, errors);
    }

    private void notifyProgress(ImportProgressListener listener, ImportProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}: {}", progress.getProcessed(), progress.getTotal(), e.getMessage());
        }
    }
}
