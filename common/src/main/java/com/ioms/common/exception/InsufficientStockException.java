package com.ioms.common.exception;

/**
 * Exception thrown when there is insufficient stock for a product
 * HTTP Status: 422 Unprocessable Entity
 */
public class InsufficientStockException extends RuntimeException {

    private final String productName;
    private final int shortfall;

    public InsufficientStockException(String productName, int shortfall) {
        super(String.format("Insufficient stock for product '%s'. Missing: %d", productName, shortfall));
        this.productName = productName;
        this.shortfall = shortfall;
    }

    public InsufficientStockException(String message) {
        super(message);
        this.productName = null;
        this.shortfall = 0;
    }

    public String getProductName() {
        return productName;
    }

    public int getShortfall() {
        return shortfall;
    }
}
