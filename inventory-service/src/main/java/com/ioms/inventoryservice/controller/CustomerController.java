package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.CustomerRequest;
import com.ioms.inventoryservice.dto.CustomerResponse;
import com.ioms.inventoryservice.dto.OrderResponse;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.CustomerService;
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
@RequestMapping("/api/v1/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;
    private final RelatedQueryService relatedQueryService;

    @PostMapping
    public ResponseEntity<CustomerResponse> createCustomer(@Valid @RequestBody CustomerRequest request) {
        CustomerResponse createdCustomer = customerService.createCustomer(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdCustomer);
    }

    @GetMapping
    public ResponseEntity<List<CustomerResponse>> getAllCustomers() {
        return ResponseEntity.ok(customerService.getAllCustomers());
    }

    // join, filter[<entity>], fields[<entity>], ordering, distinct, limit
    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.CUSTOMER, params));
    }

    @GetMapping("/{customerId}")
    public ResponseEntity<CustomerResponse> getCustomerById(@PathVariable UUID customerId) {
        return ResponseEntity.ok(customerService.getCustomerById(customerId));
    }

    @DeleteMapping("/{customerId}")
    public ResponseEntity<Void> deleteCustomer(@PathVariable UUID customerId) {
        customerService.deleteCustomer(customerId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{customerId}/orders")
    public ResponseEntity<List<OrderResponse>> getCustomerOrders(@PathVariable UUID customerId) {
        return ResponseEntity.ok(customerService.getCustomerOrders(customerId));
    }
}
