package com.retailsales.domain.ingest;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads a whole CSV document into records keyed by the first row.
 *
 * Empty lines are skipped and cells are trimmed. A leading byte order mark
 * is tolerated through header normalization. Any structural problem (no
 * header, unterminated quote, unreadable stream) is a {@link CsvImportException}.
 */
@Slf4j
@Component
public class SalesCsvParser {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    public ParsedCsv parse(InputStream input) {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new CsvImportException("CSV input has no header row");
            }

            ColumnResolution columns = ColumnResolution.resolve(headers);
            if (!columns.has(SalesColumn.TRANSACTION_ID)) {
                throw new CsvImportException("CSV header has no transaction id column: " + headers);
            }

            List<CSVRecord> records = parser.getRecords();
            log.debug("Parsed {} CSV records with {} columns", records.size(), headers.size());
            return new ParsedCsv(columns, records);

        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new CsvImportException("Malformed CSV input: " + e.getMessage(), e);
        }
    }
}
