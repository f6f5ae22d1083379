package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.CategoryRequest;
import com.ioms.inventoryservice.dto.CategoryResponse;
import com.ioms.inventoryservice.model.Category;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface CategoryMapper {

    @Mapping(target = "productsCount", source = "productsCount")
    CategoryResponse toCategoryResponse(Category category, Long productsCount);

    /**
     * Creates a new Category entity from a CategoryRequest DTO.
     * ID and creation time are assigned on persist.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "isActive", source = "isActive", defaultValue = "true")
    Category toCategory(CategoryRequest request);
}
