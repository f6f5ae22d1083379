package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.OrderItemResponse;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.OrderService;
import com.ioms.inventoryservice.services.RelatedQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of order lines. Items are created together with their order.
 */
@RestController
@RequestMapping("/api/v1/order-items")
@RequiredArgsConstructor
public class OrderItemController {

    private final OrderService orderService;
    private final RelatedQueryService relatedQueryService;

    @GetMapping
    public ResponseEntity<List<OrderItemResponse>> getAllOrderItems() {
        return ResponseEntity.ok(orderService.getAllOrderItems());
    }

    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.ORDER_ITEM, params));
    }

    @GetMapping("/{orderItemId}")
    public ResponseEntity<OrderItemResponse> getOrderItemById(@PathVariable UUID orderItemId) {
        return ResponseEntity.ok(orderService.getOrderItemById(orderItemId));
    }
}
