package com.retailsales.infrastructure.persistence.repository;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Bulk insert of sales transactions with skip-duplicates semantics.
 *
 * Rows whose transaction_id already exists are silently skipped by
 * ON CONFLICT DO NOTHING and report an update count of 0. Each call runs
 * in its own transaction, so a batch is applied entirely or not at all.
 * The PostgreSQL driver must not run with reWriteBatchedInserts, which
 * collapses the per-row counts this relies on.
 */
@Slf4j
@Repository
public class SalesBatchWriter {

    private static final String INSERT_SQL = """
            INSERT INTO sales_transactions (
                id, transaction_id, transaction_date,
                customer_id, customer_name, phone_number, gender, age, customer_region, customer_type,
                product_id, product_name, brand, product_category, tags,
                quantity, price_per_unit, discount_percentage, total_amount, final_amount,
                payment_method, order_status, delivery_type, store_id, store_location,
                salesperson_id, employee_name, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (transaction_id) DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;

    public SalesBatchWriter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert a batch, skipping rows whose business identifier already exists.
     *
     * @return number of rows actually inserted
     */
    @Transactional
    public int insertSkippingDuplicates(List<SalesTransactionEntity> rows) {
        if (rows.isEmpty()) {
            return 0;
        }

        Timestamp now = Timestamp.from(Instant.now());

        int[][] counts = jdbcTemplate.batchUpdate(INSERT_SQL, rows, rows.size(),
                (ps, row) -> {
                    ps.setObject(1, row.getId() != null ? row.getId() : UUID.randomUUID());
                    ps.setString(2, row.getTransactionId());
                    ps.setDate(3, Date.valueOf(row.getTransactionDate()));
                    ps.setString(4, row.getCustomerId());
                    ps.setString(5, row.getCustomerName());
                    ps.setString(6, row.getPhoneNumber());
                    ps.setString(7, row.getGender());
                    ps.setInt(8, row.getAge());
                    ps.setString(9, row.getCustomerRegion());
                    ps.setString(10, row.getCustomerType());
                    ps.setString(11, row.getProductId());
                    ps.setString(12, row.getProductName());
                    ps.setString(13, row.getBrand());
                    ps.setString(14, row.getProductCategory());
                    ps.setString(15, row.getTags());
                    ps.setInt(16, row.getQuantity());
                    ps.setBigDecimal(17, row.getPricePerUnit());
                    ps.setBigDecimal(18, row.getDiscountPercentage());
                    ps.setBigDecimal(19, row.getTotalAmount());
                    ps.setBigDecimal(20, row.getFinalAmount());
                    ps.setString(21, row.getPaymentMethod());
                    ps.setString(22, row.getOrderStatus());
                    ps.setString(23, row.getDeliveryType());
                    ps.setString(24, row.getStoreId());
                    ps.setString(25, row.getStoreLocation());
                    ps.setString(26, row.getSalespersonId());
                    ps.setString(27, row.getEmployeeName());
                    ps.setTimestamp(28, now);
                    ps.setTimestamp(29, now);
                });

        int inserted = 0;
        for (int[] chunk : counts) {
            for (int count : chunk) {
                if (count > 0) {
                    inserted += count;
                }
            }
        }

        log.debug("Batch insert: {} rows submitted, {} inserted, {} skipped as duplicates",
                rows.size(), inserted, rows.size() - inserted);
        return inserted;
    }
}
