package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.BrandRequest;
import com.ioms.inventoryservice.dto.BrandResponse;
import com.ioms.inventoryservice.model.Brand;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface BrandMapper {

    @Mapping(target = "productsCount", source = "productsCount")
    BrandResponse toBrandResponse(Brand brand, Long productsCount);

    /**
     * Creates a new Brand entity from a BrandRequest DTO.
     * ID and creation time are assigned on persist.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "isActive", source = "isActive", defaultValue = "true")
    Brand toBrand(BrandRequest request);
}
