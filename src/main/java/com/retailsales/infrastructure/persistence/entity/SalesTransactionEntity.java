package com.retailsales.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Entity representing a single retail sales transaction.
 *
 * Rows are immutable once ingested; there is no update path.
 *
 * Indexing Strategy:
 * - Unique index on transactionId (business identifier, skip-duplicates target)
 * - Prefix-friendly indexes on customerName and phoneNumber for search
 * - Single-column indexes on every filterable attribute
 * - Composite indexes for the common region/date/category combinations
 */
@Entity
@Table(name = "sales_transactions", indexes = {
    @Index(name = "idx_sales_transaction_id", columnList = "transactionId", unique = true),
    @Index(name = "idx_sales_customer_name", columnList = "customerName"),
    @Index(name = "idx_sales_phone_number", columnList = "phoneNumber"),
    @Index(name = "idx_sales_region", columnList = "customerRegion"),
    @Index(name = "idx_sales_gender", columnList = "gender"),
    @Index(name = "idx_sales_age", columnList = "age"),
    @Index(name = "idx_sales_category", columnList = "productCategory"),
    @Index(name = "idx_sales_payment_method", columnList = "paymentMethod"),
    @Index(name = "idx_sales_date", columnList = "transactionDate"),
    @Index(name = "idx_sales_region_date", columnList = "customerRegion,transactionDate"),
    @Index(name = "idx_sales_region_category", columnList = "customerRegion,productCategory"),
    @Index(name = "idx_sales_region_gender", columnList = "customerRegion,gender"),
    @Index(name = "idx_sales_date_category", columnList = "transactionDate,productCategory")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesTransactionEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String transactionId;

    @Column(nullable = false)
    private LocalDate transactionDate;

    private String customerId;
    private String customerName;
    private String phoneNumber;
    private String gender;

    @Column(nullable = false)
    private int age;

    private String customerRegion;
    private String customerType;

    private String productId;
    private String productName;
    private String brand;
    private String productCategory;

    // Comma-separated
    @Column(length = 1000)
    private String tags;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal pricePerUnit;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal finalAmount;

    private String paymentMethod;
    private String orderStatus;
    private String deliveryType;
    private String storeId;
    private String storeLocation;
    private String salespersonId;
    private String employeeName;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
