package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.model.Order;

import java.util.UUID;

public interface StockReservationService {

    /**
     * Reserves stock for every item of a PENDING order and moves it to CONFIRMED.
     * Either all items are fully reserved or nothing is changed.
     *
     * @throws com.ioms.common.exception.InvalidStateTransitionException if the order is not PENDING
     * @throws com.ioms.common.exception.InsufficientStockException      if any item cannot be fully reserved
     */
    Order confirmOrder(UUID orderId);
}
