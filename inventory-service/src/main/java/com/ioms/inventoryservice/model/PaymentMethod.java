package com.ioms.inventoryservice.model;

public enum PaymentMethod {
    CARD,
    TRANSFER,
    COD
}
