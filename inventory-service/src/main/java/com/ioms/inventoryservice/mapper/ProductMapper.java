package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.ProductRequest;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.model.Product;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface ProductMapper {

    /**
     * Converts the Product entity to a ProductResponse DTO.
     * Brand and category must be initialised (fetched) by the caller; the stock total comes from an aggregate query.
     */
    @Mapping(source = "product.brand.id", target = "brandId")
    @Mapping(source = "product.brand.name", target = "brandName")
    @Mapping(source = "product.category.id", target = "categoryId")
    @Mapping(source = "product.category.name", target = "categoryName")
    @Mapping(source = "totalStock", target = "totalStock")
    ProductResponse toProductResponse(Product product, Long totalStock);

    /**
     * Creates a new Product entity from a ProductRequest DTO.
     * Brand and category are resolved from their IDs in the service layer.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "brand", ignore = true)
    @Mapping(target = "category", ignore = true)
    @Mapping(target = "isActive", source = "isActive", defaultValue = "true")
    Product toProduct(ProductRequest request);
}
