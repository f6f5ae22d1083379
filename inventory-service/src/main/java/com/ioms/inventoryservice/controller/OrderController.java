package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.OrderRequest;
import com.ioms.inventoryservice.dto.OrderResponse;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.OrderService;
import com.ioms.inventoryservice.services.RelatedQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final RelatedQueryService relatedQueryService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody OrderRequest request) {
        OrderResponse createdOrder = orderService.createOrder(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdOrder);
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getAllOrders() {
        return ResponseEntity.ok(orderService.getAllOrders());
    }

    // join, filter[<entity>], fields[<entity>], ordering, distinct, limit
    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.ORDER, params));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrderById(orderId));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable UUID orderId) {
        orderService.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Reserves stock for every item and moves the order to CONFIRMED.
     * 409 if the order is not PENDING, 422 if any item cannot be fully reserved (nothing is reserved then).
     */
    @PostMapping("/{orderId}/confirm")
    public ResponseEntity<OrderResponse> confirmOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.confirmOrder(orderId));
    }
}
