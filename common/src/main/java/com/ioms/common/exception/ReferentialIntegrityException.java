package com.ioms.common.exception;

/**
 * Exception thrown when a delete is attempted on an entity that is still
 * referenced through a restrict-delete relationship
 * (e.g. a brand that still has products, a customer that still has orders)
 * HTTP Status: 409 Conflict
 */
public class ReferentialIntegrityException extends RuntimeException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }
}
