package com.ioms.inventoryservice.model;

public enum OrderStatus {
    PENDING,
    CONFIRMED,
    CANCELED
}
