package com.ioms.inventoryservice.query.schema;

public enum Cardinality {
    ONE,
    MANY
}
