package com.ioms.inventoryservice.query;

/**
 * Raised when a related-entity query cannot be planned or executed.
 * Mapped to HTTP 400 by the global exception handler.
 */
public class RelatedQueryException extends RuntimeException {

    public RelatedQueryException(String message) {
        super(message);
    }

    public RelatedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
