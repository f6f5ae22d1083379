package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.StockRequest;
import com.ioms.inventoryservice.dto.StockResponse;

import java.util.List;
import java.util.UUID;

public interface StockService {
    // One stock row per (product, warehouse) pair
    StockResponse createStock(StockRequest request);

    List<StockResponse> getAllStocks();

    StockResponse getStockById(UUID stockId);

    void deleteStock(UUID stockId);

    // Rows with qty > reserved
    List<StockResponse> getAvailableStocks();
}
