package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.OrderItemResponse;
import com.ioms.inventoryservice.dto.OrderRequest;
import com.ioms.inventoryservice.dto.OrderResponse;

import java.util.List;
import java.util.UUID;

public interface OrderService {
    // New orders start PENDING; no stock is reserved until confirmation
    OrderResponse createOrder(OrderRequest request);

    // Newest first
    List<OrderResponse> getAllOrders();

    OrderResponse getOrderById(UUID orderId);

    // Removes the order's items and payment as well
    void deleteOrder(UUID orderId);

    // PENDING -> CONFIRMED, reserving stock for every item
    OrderResponse confirmOrder(UUID orderId);

    List<OrderItemResponse> getAllOrderItems();

    OrderItemResponse getOrderItemById(UUID orderItemId);
}
