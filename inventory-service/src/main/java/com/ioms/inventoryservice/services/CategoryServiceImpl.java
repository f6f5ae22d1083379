package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.CategoryRequest;
import com.ioms.inventoryservice.dto.CategoryResponse;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.mapper.CategoryMapper;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.repository.CategoryRepository;
import com.ioms.inventoryservice.repository.OwnerTotal;
import com.ioms.inventoryservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CategoryServiceImpl implements CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryServiceImpl.class);

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final CategoryMapper categoryMapper;
    private final ProductResponseAssembler productResponseAssembler;

    @Override
    @Transactional
    public CategoryResponse createCategory(CategoryRequest request) {
        // Category names are unique regardless of case
        if (categoryRepository.existsByNameIgnoreCase(request.getName())) {
            throw new DuplicateResourceException("Category already exists: " + request.getName());
        }

        Category savedCategory = categoryRepository.save(categoryMapper.toCategory(request));
        log.info("Category created: id={}, name='{}'", savedCategory.getId(), savedCategory.getName());
        return categoryMapper.toCategoryResponse(savedCategory, 0L);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CategoryResponse> getAllCategories() {
        Map<UUID, Long> productCounts = OwnerTotal.toMap(productRepository.countActivePerCategory());
        return categoryRepository.findAllByOrderByNameAsc().stream()
                .map(category -> categoryMapper.toCategoryResponse(
                        category, productCounts.getOrDefault(category.getId(), 0L)))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public CategoryResponse getCategoryById(UUID categoryId) {
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
        return categoryMapper.toCategoryResponse(
                category, productRepository.countByCategoryIdAndIsActiveTrue(categoryId));
    }

    @Override
    @Transactional
    public void deleteCategory(UUID categoryId) {
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));

        // Products keep a restrict reference to their category
        if (productRepository.existsByCategoryId(categoryId)) {
            log.warn("Delete rejected: category {} still has products", categoryId);
            throw new ReferentialIntegrityException("Cannot delete category '" + category.getName() + "': it still has products");
        }

        categoryRepository.delete(category);
        log.info("Category deleted: id={}, name='{}'", categoryId, category.getName());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductResponse> getCategoryProducts(UUID categoryId) {
        // Verify category exists
        if (!categoryRepository.existsById(categoryId)) {
            throw new ResourceNotFoundException("Category not found");
        }

        return productResponseAssembler.toResponses(productRepository.findActiveByCategoryId(categoryId));
    }
}
