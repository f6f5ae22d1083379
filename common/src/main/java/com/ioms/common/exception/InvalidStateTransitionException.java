package com.ioms.common.exception;

/**
 * Exception thrown when a status transition is not allowed from the current state
 * For example: confirming an order that is already CONFIRMED
 * HTTP Status: 409 Conflict
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
