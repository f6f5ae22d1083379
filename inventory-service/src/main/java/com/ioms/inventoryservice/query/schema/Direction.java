package com.ioms.inventoryservice.query.schema;

/**
 * Which side of a relation holds the foreign key.
 */
public enum Direction {
    /** The source entity holds the foreign key (e.g. product to brand). */
    FORWARD,
    /** The target entity holds a foreign key back to the source (e.g. brand to its products). */
    REVERSE
}
