package com.retailsales.domain.model;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outbound view of a sales transaction.
 *
 * Monetary fields are exact decimals at scale 2 and serialize as JSON numbers;
 * the date is an ISO calendar date without time of day.
 */
@Value
@Builder
public class SalesRecordView {

    private static final int MONEY_SCALE = 2;

    String transactionId;
    String date;
    String customerId;
    String customerName;
    String phoneNumber;
    String gender;
    int age;
    String customerRegion;
    String customerType;
    String productId;
    String productName;
    String brand;
    String productCategory;
    String tags;
    int quantity;
    BigDecimal pricePerUnit;
    BigDecimal discountPercentage;
    BigDecimal totalAmount;
    BigDecimal finalAmount;
    String paymentMethod;
    String orderStatus;
    String deliveryType;
    String storeId;
    String storeLocation;
    String salespersonId;
    String employeeName;

    public static SalesRecordView from(SalesTransactionEntity entity) {
        return SalesRecordView.builder()
                .transactionId(entity.getTransactionId())
                .date(entity.getTransactionDate().toString())
                .customerId(entity.getCustomerId())
                .customerName(entity.getCustomerName())
                .phoneNumber(entity.getPhoneNumber())
                .gender(entity.getGender())
                .age(entity.getAge())
                .customerRegion(entity.getCustomerRegion())
                .customerType(entity.getCustomerType())
                .productId(entity.getProductId())
                .productName(entity.getProductName())
                .brand(entity.getBrand())
                .productCategory(entity.getProductCategory())
                .tags(entity.getTags())
                .quantity(entity.getQuantity())
                .pricePerUnit(money(entity.getPricePerUnit()))
                .discountPercentage(money(entity.getDiscountPercentage()))
                .totalAmount(money(entity.getTotalAmount()))
                .finalAmount(money(entity.getFinalAmount()))
                .paymentMethod(entity.getPaymentMethod())
                .orderStatus(entity.getOrderStatus())
                .deliveryType(entity.getDeliveryType())
                .storeId(entity.getStoreId())
                .storeLocation(entity.getStoreLocation())
                .salespersonId(entity.getSalespersonId())
                .employeeName(entity.getEmployeeName())
                .build();
    }

    static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(MONEY_SCALE) : value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
