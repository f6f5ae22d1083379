package com.ioms.inventoryservice.query;

public class InvalidFilterValueException extends RelatedQueryException {

    public InvalidFilterValueException(String message) {
        super(message);
    }

    public InvalidFilterValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
