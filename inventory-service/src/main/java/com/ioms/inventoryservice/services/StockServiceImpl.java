package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.StockRequest;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.mapper.StockMapper;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.model.Warehouse;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import com.ioms.inventoryservice.repository.WarehouseRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StockServiceImpl implements StockService {

    private static final Logger log = LoggerFactory.getLogger(StockServiceImpl.class);

    private final StockRepository stockRepository;
    private final ProductRepository productRepository;
    private final WarehouseRepository warehouseRepository;
    private final StockMapper stockMapper;

    @Override
    @Transactional
    public StockResponse createStock(StockRequest request) {
        Product product = productRepository.findById(request.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
        Warehouse warehouse = warehouseRepository.findById(request.getWarehouseId())
                .orElseThrow(() -> new ResourceNotFoundException("Warehouse not found"));

        if (stockRepository.existsByProductIdAndWarehouseId(product.getId(), warehouse.getId())) {
            throw new DuplicateResourceException(String.format(
                    "Stock for product '%s' already exists in warehouse '%s'", product.getName(), warehouse.getName()));
        }

        Stock stock = stockMapper.toStock(request);
        if (stock.getReserved() > stock.getQty()) {
            throw new IllegalArgumentException(String.format(
                    "Reserved quantity (%d) cannot exceed quantity (%d)", stock.getReserved(), stock.getQty()));
        }
        stock.setProduct(product);
        stock.setWarehouse(warehouse);

        Stock savedStock = stockRepository.save(stock);
        log.info("Stock created: id={}, productId={}, warehouseId={}, qty={}, reserved={}",
                savedStock.getId(), product.getId(), warehouse.getId(), savedStock.getQty(), savedStock.getReserved());
        return stockMapper.toStockResponse(savedStock);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockResponse> getAllStocks() {
        return stockRepository.findAllWithProductAndWarehouse().stream()
                .map(stockMapper::toStockResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public StockResponse getStockById(UUID stockId) {
        Stock stock = stockRepository.findWithProductAndWarehouseById(stockId)
                .orElseThrow(() -> new ResourceNotFoundException("Stock not found"));
        return stockMapper.toStockResponse(stock);
    }

    @Override
    @Transactional
    public void deleteStock(UUID stockId) {
        Stock stock = stockRepository.findById(stockId)
                .orElseThrow(() -> new ResourceNotFoundException("Stock not found"));

        stockRepository.delete(stock);
        log.info("Stock deleted: id={}, qty={}, reserved={}", stockId, stock.getQty(), stock.getReserved());
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockResponse> getAvailableStocks() {
        return stockRepository.findAvailable().stream()
                .map(stockMapper::toStockResponse)
                .toList();
    }
}
