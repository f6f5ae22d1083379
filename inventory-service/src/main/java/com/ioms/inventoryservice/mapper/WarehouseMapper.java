package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.WarehouseRequest;
import com.ioms.inventoryservice.dto.WarehouseResponse;
import com.ioms.inventoryservice.model.Warehouse;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface WarehouseMapper {

    @Mapping(target = "totalProducts", source = "totalProducts")
    WarehouseResponse toWarehouseResponse(Warehouse warehouse, Long totalProducts);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    Warehouse toWarehouse(WarehouseRequest request);
}
