package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.CategoryRequest;
import com.ioms.inventoryservice.dto.CategoryResponse;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.CategoryService;
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
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;
    private final RelatedQueryService relatedQueryService;

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(@Valid @RequestBody CategoryRequest request) {
        CategoryResponse createdCategory = categoryService.createCategory(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdCategory);
    }

    @GetMapping
    public ResponseEntity<List<CategoryResponse>> getAllCategories() {
        return ResponseEntity.ok(categoryService.getAllCategories());
    }

    // join, filter[<entity>], fields[<entity>], ordering, distinct, limit
    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.CATEGORY, params));
    }

    @GetMapping("/{categoryId}")
    public ResponseEntity<CategoryResponse> getCategoryById(@PathVariable UUID categoryId) {
        return ResponseEntity.ok(categoryService.getCategoryById(categoryId));
    }

    @DeleteMapping("/{categoryId}")
    public ResponseEntity<Void> deleteCategory(@PathVariable UUID categoryId) {
        categoryService.deleteCategory(categoryId);
        return ResponseEntity.noContent().build();
    }

    // Active products of the category
    @GetMapping("/{categoryId}/products")
    public ResponseEntity<List<ProductResponse>> getCategoryProducts(@PathVariable UUID categoryId) {
        return ResponseEntity.ok(categoryService.getCategoryProducts(categoryId));
    }
}
