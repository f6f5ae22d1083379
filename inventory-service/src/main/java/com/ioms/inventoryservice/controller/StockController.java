package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.dto.StockRequest;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.RelatedQueryService;
import com.ioms.inventoryservice.services.StockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/stocks")
@RequiredArgsConstructor
public class StockController {

    private final StockService stockService;
    private final RelatedQueryService relatedQueryService;

    @PostMapping
    public ResponseEntity<StockResponse> createStock(@Valid @RequestBody StockRequest request) {
        StockResponse createdStock = stockService.createStock(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdStock);
    }

    @GetMapping
    public ResponseEntity<List<StockResponse>> getAllStocks() {
        return ResponseEntity.ok(stockService.getAllStocks());
    }

    // join, filter[<entity>], fields[<entity>], ordering, distinct, limit
    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.STOCK, params));
    }

    @GetMapping("/{stockId}")
    public ResponseEntity<StockResponse> getStockById(@PathVariable UUID stockId) {
        return ResponseEntity.ok(stockService.getStockById(stockId));
    }

    @DeleteMapping("/{stockId}")
    public ResponseEntity<Void> deleteStock(@PathVariable UUID stockId) {
        stockService.deleteStock(stockId);
        return ResponseEntity.noContent().build();
    }

    // Rows that still have unreserved units
    @GetMapping("/available")
    public ResponseEntity<List<StockResponse>> getAvailableStocks() {
        return ResponseEntity.ok(stockService.getAvailableStocks());
    }
}
