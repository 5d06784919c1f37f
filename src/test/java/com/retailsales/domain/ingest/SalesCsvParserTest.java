package com.retailsales.domain.ingest;

import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SalesCsvParserTest {

    private final SalesCsvParser parser = new SalesCsvParser();

    @Test
    void testParse_HeaderSpellingsResolveToSameColumns() {
        ParsedCsv spaced = parse("Transaction ID,Customer Name,Price per Unit\nT1,Alice,10.5\n");
        ParsedCsv snake = parse("transaction_id,customer_name,price_per_unit\nT1,Alice,10.5\n");
        ParsedCsv camel = parse("TransactionID,CustomerName,PricePerUnit\nT1,Alice,10.5\n");

        for (ParsedCsv csv : new ParsedCsv[]{spaced, snake, camel}) {
            CSVRecord record = csv.getRecords().get(0);
            assertEquals("T1", csv.getColumns().value(record, SalesColumn.TRANSACTION_ID));
            assertEquals("Alice", csv.getColumns().value(record, SalesColumn.CUSTOMER_NAME));
            assertEquals("10.5", csv.getColumns().value(record, SalesColumn.PRICE_PER_UNIT));
        }
    }

    @Test
    void testParse_ByteOrderMarkAndOddCasing() {
        ParsedCsv csv = parse("\uFEFFTRANSACTION id,customer name\nT9,Bob\n");

        CSVRecord record = csv.getRecords().get(0);
        assertEquals("T9", csv.getColumns().value(record, SalesColumn.TRANSACTION_ID));
        assertEquals("Bob", csv.getColumns().value(record, SalesColumn.CUSTOMER_NAME));
    }

    @Test
    void testParse_SkipsEmptyLinesAndTrims() {
        ParsedCsv csv = parse("Transaction ID,Gender\n\n T1 , Female \n\nT2,Male\n");

        assertEquals(2, csv.getRecords().size());
        assertEquals("Female", csv.getColumns().value(csv.getRecords().get(0), SalesColumn.GENDER));
    }

    @Test
    void testParse_QuotedTagsKeepCommas() {
        ParsedCsv csv = parse("Transaction ID,Tags\nT1,\"organic,eco\"\n");

        assertEquals("organic,eco", csv.getColumns().value(csv.getRecords().get(0), SalesColumn.TAGS));
    }

    @Test
    void testParse_ShortRowReadsAsMissing() {
        ParsedCsv csv = parse("Transaction ID,Gender,Age\nT1\n");

        CSVRecord record = csv.getRecords().get(0);
        assertNull(csv.getColumns().value(record, SalesColumn.AGE));
        assertNull(csv.getColumns().value(record, SalesColumn.BRAND));
    }

    @Test
    void testParse_EmptyInputIsFatal() {
        assertThrows(CsvImportException.class, () -> parse(""));
    }

    @Test
    void testParse_MissingTransactionIdColumnIsFatal() {
        assertThrows(CsvImportException.class, () -> parse("Customer Name,Age\nAlice,30\n"));
    }

    @Test
    void testParse_UnterminatedQuoteIsFatal() {
        assertThrows(CsvImportException.class, () -> parse("Transaction ID,Customer Name\nT1,\"Alice\nT2,Bob\n"));
    }

    private ParsedCsv parse(String csv) {
        return parser.parse(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }
}
