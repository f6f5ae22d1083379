package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.dto.WarehouseRequest;
import com.ioms.inventoryservice.dto.WarehouseResponse;

import java.util.List;
import java.util.UUID;

public interface WarehouseService {
    WarehouseResponse createWarehouse(WarehouseRequest request);

    // Ordered by city, then name
    List<WarehouseResponse> getAllWarehouses();

    WarehouseResponse getWarehouseById(UUID warehouseId);

    // Stock rows held in the warehouse are removed with it
    void deleteWarehouse(UUID warehouseId);

    List<StockResponse> getWarehouseStock(UUID warehouseId);
}
