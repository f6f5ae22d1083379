package com.ioms.common.exception;

/**
 * Exception thrown when creating a resource would break a uniqueness rule
 * (brand name, product sku, customer email, one payment per order...)
 * HTTP Status: 409 Conflict
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
