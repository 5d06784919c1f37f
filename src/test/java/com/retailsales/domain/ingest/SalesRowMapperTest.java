package com.retailsales.domain.ingest;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SalesRowMapperTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private final SalesRowMapper mapper = new SalesRowMapper(
            Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));

    private final SalesCsvParser parser = new SalesCsvParser();

    @Test
    void testMap_FullRow() {
        SalesTransactionEntity row = mapSingle(
                "Transaction ID,Date,Customer Name,Phone Number,Gender,Age,Customer Region,Product Category,"
                        + "Tags,Quantity,Price per Unit,Discount Percentage,Total Amount,Final Amount,Payment Method\n"
                        + "T1,05-03-2023,Alice Smith,9876543210,Female,34,North,Clothing,\"organic,eco\","
                        + "3,49.99,10,149.97,134.97,UPI\n");

        assertEquals("T1", row.getTransactionId());
        assertEquals(LocalDate.of(2023, 3, 5), row.getTransactionDate());
        assertEquals("Alice Smith", row.getCustomerName());
        assertEquals(34, row.getAge());
        assertEquals(3, row.getQuantity());
        assertEquals(new BigDecimal("49.99"), row.getPricePerUnit());
        assertEquals(new BigDecimal("134.97"), row.getFinalAmount());
        assertEquals("organic,eco", row.getTags());
        assertNull(row.getBrand());
    }

    @Test
    void testMap_UnparseableNumbersDefaultToZero() {
        SalesTransactionEntity row = mapSingle("Transaction ID,Age,Quantity,Total Amount\nT1,abc,,n/a\n");

        assertEquals(0, row.getAge());
        assertEquals(0, row.getQuantity());
        assertEquals(BigDecimal.ZERO, row.getTotalAmount());
        assertEquals(BigDecimal.ZERO, row.getPricePerUnit());
    }

    @Test
    void testMap_DecimalQuantityTruncates() {
        assertEquals(4, mapSingle("Transaction ID,Quantity\nT1,4.0\n").getQuantity());
    }

    @Test
    void testMap_OutOfRangeIntegersDefaultToZero() {
        SalesTransactionEntity row = mapSingle("Transaction ID,Age,Quantity\nT1,99999999999,1e10\n");

        assertEquals(0, row.getAge());
        assertEquals(0, row.getQuantity());
    }

    @Test
    void testParseInt_FractionTruncatesWithinRange() {
        assertEquals(4, SalesRowMapper.parseInt("4.7"));
        assertEquals(-3, SalesRowMapper.parseInt("-3.9"));
        assertEquals(0, SalesRowMapper.parseInt("99999999999"));
        assertEquals(0, SalesRowMapper.parseInt("1e10"));
    }

    @Test
    void testMap_DateFormats() {
        assertEquals(LocalDate.of(2023, 3, 5), mapSingle("Transaction ID,Date\nT1,05-03-2023\n").getTransactionDate());
        assertEquals(LocalDate.of(2023, 3, 5), mapSingle("Transaction ID,Date\nT1,2023-03-05\n").getTransactionDate());
        assertEquals(LocalDate.of(2023, 3, 5), mapSingle("Transaction ID,Date\nT1,05/03/2023\n").getTransactionDate());
        assertEquals(LocalDate.of(2023, 3, 5),
                mapSingle("Transaction ID,Date\nT1,2023-03-05T10:15:30Z\n").getTransactionDate());
    }

    @Test
    void testMap_BadOrMissingDateIsToday() {
        assertEquals(TODAY, mapSingle("Transaction ID,Date\nT1,yesterday\n").getTransactionDate());
        assertEquals(TODAY, mapSingle("Transaction ID,Date\nT1,31-02-2023\n").getTransactionDate());
        assertEquals(TODAY, mapSingle("Transaction ID\nT1\n").getTransactionDate());
    }

    @Test
    void testMap_MissingTransactionIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> mapSingle("Transaction ID,Age\n,30\n"));
    }

    private SalesTransactionEntity mapSingle(String csv) {
        ParsedCsv parsed = parser.parse(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
        return mapper.map(parsed.getRecords().get(0), parsed.getColumns());
    }
}
