package com.retailsales.domain.ingest;

import java.util.List;
import java.util.Locale;

/**
 * Logical sales columns and the header spellings accepted for each.
 *
 * Spellings are tried in order. Headers also match after normalization
 * (lowercase, non-alphanumerics removed), so "Customer Name",
 * "customer_name" and "CustomerName" all land on the same column.
 */
public enum SalesColumn {

    TRANSACTION_ID("Transaction ID", "transaction_id", "TransactionID"),
    DATE("Date", "date"),
    CUSTOMER_ID("Customer ID", "customer_id", "CustomerID"),
    CUSTOMER_NAME("Customer Name", "customer_name", "CustomerName"),
    PHONE_NUMBER("Phone Number", "phone_number", "PhoneNumber"),
    GENDER("Gender", "gender"),
    AGE("Age", "age"),
    CUSTOMER_REGION("Customer Region", "customer_region", "CustomerRegion"),
    CUSTOMER_TYPE("Customer Type", "customer_type", "CustomerType"),
    PRODUCT_ID("Product ID", "product_id", "ProductID"),
    PRODUCT_NAME("Product Name", "product_name", "ProductName"),
    BRAND("Brand", "brand"),
    PRODUCT_CATEGORY("Product Category", "product_category", "ProductCategory"),
    TAGS("Tags", "tags"),
    QUANTITY("Quantity", "quantity"),
    PRICE_PER_UNIT("Price per Unit", "price_per_unit", "PricePerUnit"),
    DISCOUNT_PERCENTAGE("Discount Percentage", "discount_percentage", "DiscountPercentage"),
    TOTAL_AMOUNT("Total Amount", "total_amount", "TotalAmount"),
    FINAL_AMOUNT("Final Amount", "final_amount", "FinalAmount"),
    PAYMENT_METHOD("Payment Method", "payment_method", "PaymentMethod"),
    ORDER_STATUS("Order Status", "order_status", "OrderStatus"),
    DELIVERY_TYPE("Delivery Type", "delivery_type", "DeliveryType"),
    STORE_ID("Store ID", "store_id", "StoreID"),
    STORE_LOCATION("Store Location", "store_location", "StoreLocation"),
    SALESPERSON_ID("Salesperson ID", "salesperson_id", "SalespersonID"),
    EMPLOYEE_NAME("Employee Name", "employee_name", "EmployeeName");

    private final List<String> spellings;

    SalesColumn(String... spellings) {
        this.spellings = List.of(spellings);
    }

    public List<String> getSpellings() {
        return spellings;
    }

    static String normalize(String header) {
        return header == null ? "" : header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
