package com.ioms.inventoryservice.services;

import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.dto.WarehouseRequest;
import com.ioms.inventoryservice.dto.WarehouseResponse;
import com.ioms.inventoryservice.mapper.StockMapper;
import com.ioms.inventoryservice.mapper.WarehouseMapper;
import com.ioms.inventoryservice.model.Warehouse;
import com.ioms.inventoryservice.repository.OwnerTotal;
import com.ioms.inventoryservice.repository.StockRepository;
import com.ioms.inventoryservice.repository.WarehouseRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class WarehouseServiceImpl implements WarehouseService {

    private static final Logger log = LoggerFactory.getLogger(WarehouseServiceImpl.class);

    private final WarehouseRepository warehouseRepository;
    private final StockRepository stockRepository;
    private final WarehouseMapper warehouseMapper;
    private final StockMapper stockMapper;

    @Override
    @Transactional
    public WarehouseResponse createWarehouse(WarehouseRequest request) {
        Warehouse savedWarehouse = warehouseRepository.save(warehouseMapper.toWarehouse(request));
        log.info("Warehouse created: id={}, name='{}', city='{}'",
                savedWarehouse.getId(), savedWarehouse.getName(), savedWarehouse.getCity());
        return warehouseMapper.toWarehouseResponse(savedWarehouse, 0L);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WarehouseResponse> getAllWarehouses() {
        Map<UUID, Long> stockedCounts = OwnerTotal.toMap(stockRepository.countStockedPerWarehouse());
        return warehouseRepository.findAllByOrderByCityAscNameAsc().stream()
                .map(warehouse -> warehouseMapper.toWarehouseResponse(
                        warehouse, stockedCounts.getOrDefault(warehouse.getId(), 0L)))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public WarehouseResponse getWarehouseById(UUID warehouseId) {
        Warehouse warehouse = warehouseRepository.findById(warehouseId)
                .orElseThrow(() -> new ResourceNotFoundException("Warehouse not found"));
        return warehouseMapper.toWarehouseResponse(
                warehouse, stockRepository.countByWarehouseIdAndQtyGreaterThan(warehouseId, 0));
    }

    @Override
    @Transactional
    public void deleteWarehouse(UUID warehouseId) {
        Warehouse warehouse = warehouseRepository.findById(warehouseId)
                .orElseThrow(() -> new ResourceNotFoundException("Warehouse not found"));

        int removedStocks = stockRepository.deleteByWarehouseId(warehouseId);
        warehouseRepository.delete(warehouse);
        log.info("Warehouse deleted: id={}, name='{}', stockRowsRemoved={}",
                warehouseId, warehouse.getName(), removedStocks);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockResponse> getWarehouseStock(UUID warehouseId) {
        // Verify warehouse exists
        if (!warehouseRepository.existsById(warehouseId)) {
            throw new ResourceNotFoundException("Warehouse not found");
        }

        return stockRepository.findByWarehouseIdWithProduct(warehouseId).stream()
                .map(stockMapper::toStockResponse)
                .toList();
    }
}
