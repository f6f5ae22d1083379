package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.StockRequest;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.model.Stock;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface StockMapper {

    @Mapping(source = "product.id", target = "productId")
    @Mapping(source = "product.name", target = "productName")
    @Mapping(source = "product.sku", target = "productSku")
    @Mapping(source = "warehouse.id", target = "warehouseId")
    @Mapping(source = "warehouse.name", target = "warehouseName")
    @Mapping(source = "availableQty", target = "availableQty")
    StockResponse toStockResponse(Stock stock);

    /**
     * Product and warehouse are resolved from their IDs in the service layer.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "product", ignore = true)
    @Mapping(target = "warehouse", ignore = true)
    @Mapping(target = "reserved", source = "reserved", defaultValue = "0")
    Stock toStock(StockRequest request);
}
