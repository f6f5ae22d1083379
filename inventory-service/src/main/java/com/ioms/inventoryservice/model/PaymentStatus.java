package com.ioms.inventoryservice.model;

public enum PaymentStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
