package com.ioms.inventoryservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {

    @NotNull(message = "Customer ID cannot be null")
    private UUID customerId;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // Triggers validation for each OrderItemRequest in the list
    private List<OrderItemRequest> items;
}
