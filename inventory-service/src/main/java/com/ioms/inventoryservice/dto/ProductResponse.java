package com.ioms.inventoryservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private UUID id;
    private String name;
    private String sku;
    private BigDecimal price;
    private Boolean isActive;
    private Instant createdAt;
    private UUID brandId;
    private String brandName;
    private UUID categoryId;
    private String categoryName;
    // sum of qty over every warehouse, reserved units included
    private Long totalStock;
}
