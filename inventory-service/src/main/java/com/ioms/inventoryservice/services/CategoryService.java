package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.CategoryRequest;
import com.ioms.inventoryservice.dto.CategoryResponse;
import com.ioms.inventoryservice.dto.ProductResponse;

import java.util.List;
import java.util.UUID;

public interface CategoryService {
    CategoryResponse createCategory(CategoryRequest request);

    // Ordered by name
    List<CategoryResponse> getAllCategories();

    CategoryResponse getCategoryById(UUID categoryId);

    // Rejected while the category still has products
    void deleteCategory(UUID categoryId);

    // Active products of the category
    List<ProductResponse> getCategoryProducts(UUID categoryId);
}
