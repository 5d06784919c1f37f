package com.retailsales.domain.ingest;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

import static com.retailsales.domain.ingest.SalesColumn.*;

/**
 * Maps one CSV record to a sales transaction.
 *
 * Coercion rules:
 * - Missing or blank transaction id: the row is rejected
 * - Integers and amounts that do not parse: 0
 * - Dates: dd-MM-yyyy, yyyy-MM-dd, dd/MM/yyyy or an ISO date-time;
 *   anything else falls back to today
 * - Blank text cells: null
 */
@Component
public class SalesRowMapper {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT));

    private final Clock clock;

    public SalesRowMapper(Clock clock) {
        this.clock = clock;
    }

    public SalesTransactionEntity map(CSVRecord record, ColumnResolution columns) {
        String transactionId = columns.value(record, TRANSACTION_ID);
        if (transactionId == null) {
            throw new IllegalArgumentException("Missing transaction id at record " + record.getRecordNumber());
        }

        return SalesTransactionEntity.builder()
                .transactionId(transactionId)
                .transactionDate(parseDate(columns.value(record, DATE)))
                .customerId(columns.value(record, CUSTOMER_ID))
                .customerName(columns.value(record, CUSTOMER_NAME))
                .phoneNumber(columns.value(record, PHONE_NUMBER))
                .gender(columns.value(record, GENDER))
                .age(parseInt(columns.value(record, AGE)))
                .customerRegion(columns.value(record, CUSTOMER_REGION))
                .customerType(columns.value(record, CUSTOMER_TYPE))
                .productId(columns.value(record, PRODUCT_ID))
                .productName(columns.value(record, PRODUCT_NAME))
                .brand(columns.value(record, BRAND))
                .productCategory(columns.value(record, PRODUCT_CATEGORY))
                .tags(columns.value(record, TAGS))
                .quantity(parseInt(columns.value(record, QUANTITY)))
                .pricePerUnit(parseDecimal(columns.value(record, PRICE_PER_UNIT)))
                .discountPercentage(parseDecimal(columns.value(record, DISCOUNT_PERCENTAGE)))
                .totalAmount(parseDecimal(columns.value(record, TOTAL_AMOUNT)))
                .finalAmount(parseDecimal(columns.value(record, FINAL_AMOUNT)))
                .paymentMethod(columns.value(record, PAYMENT_METHOD))
                .orderStatus(columns.value(record, ORDER_STATUS))
                .deliveryType(columns.value(record, DELIVERY_TYPE))
                .storeId(columns.value(record, STORE_ID))
                .storeLocation(columns.value(record, STORE_LOCATION))
                .salespersonId(columns.value(record, SALESPERSON_ID))
                .employeeName(columns.value(record, EMPLOYEE_NAME))
                .build();
    }

    static int parseInt(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return truncateToInt(parseDecimal(value));
        }
    }

    // "42.0" style cells truncate; values outside the int range count as unparseable
    private static int truncateToInt(BigDecimal value) {
        try {
            return value.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            return 0;
        }
    }

    static BigDecimal parseDecimal(String value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    LocalDate parseDate(String value) {
        if (value == null) {
            return LocalDate.now(clock);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParse(value, format);
            if (date != null) {
                return date;
            }
        }
        // ISO date-time: keep the calendar date
        if (value.length() > 10 && value.charAt(10) == 'T') {
            LocalDate date = tryParse(value.substring(0, 10), DateTimeFormatter.ISO_LOCAL_DATE);
            if (date != null) {
                return date;
            }
        }
        return LocalDate.now(clock);
    }

    private static LocalDate tryParse(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
