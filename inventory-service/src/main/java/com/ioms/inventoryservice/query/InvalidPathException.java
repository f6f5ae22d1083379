package com.ioms.inventoryservice.query;

/**
 * A relation path, filter field or ordering field does not exist on the entity it was applied to.
 */
public class InvalidPathException extends RelatedQueryException {

    public InvalidPathException(String message) {
        super(message);
    }
}
