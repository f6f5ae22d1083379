package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.config.InventoryProperties;
import com.ioms.inventoryservice.dto.ProductRequest;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.mapper.ProductMapper;
import com.ioms.inventoryservice.mapper.StockMapper;
import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.repository.BrandRepository;
import com.ioms.inventoryservice.repository.CategoryRepository;
import com.ioms.inventoryservice.repository.OrderItemRepository;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ProductServiceImpl implements ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductServiceImpl.class);

    private final ProductRepository productRepository;
    private final BrandRepository brandRepository;
    private final CategoryRepository categoryRepository;
    private final StockRepository stockRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductMapper productMapper;
    private final StockMapper stockMapper;
    private final ProductResponseAssembler productResponseAssembler;
    private final InventoryProperties properties;

    @Override
    @Transactional
    public ProductResponse createProduct(ProductRequest request) {
        if (productRepository.existsBySku(request.getSku())) {
            throw new DuplicateResourceException("Product with SKU already exists: " + request.getSku());
        }

        // Find brand and category
        Brand brand = brandRepository.findById(request.getBrandId())
                .orElseThrow(() -> new ResourceNotFoundException("Brand not found"));
        Category category = categoryRepository.findById(request.getCategoryId())
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));

        Product product = productMapper.toProduct(request);
        product.setBrand(brand);
        product.setCategory(category);

        Product savedProduct = productRepository.save(product);
        log.info("Product created: id={}, name='{}', sku={}, brandId={}, categoryId={}, price={}",
                savedProduct.getId(), savedProduct.getName(), savedProduct.getSku(),
                brand.getId(), category.getId(), savedProduct.getPrice());
        // a new product has no stock rows yet
        return productMapper.toProductResponse(savedProduct, 0L);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductResponse> getAllProducts() {
        return productResponseAssembler.toResponsesOfAll(productRepository.findAllWithBrandAndCategory());
    }

    @Override
    @Transactional(readOnly = true)
    public ProductResponse getProductById(UUID productId) {
        Product product = productRepository.findWithBrandAndCategoryById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
        return productResponseAssembler.toResponse(product);
    }

    @Override
    @Transactional
    public void deleteProduct(UUID productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));

        // Order history must survive, so ordered products cannot be removed
        if (orderItemRepository.existsByProductId(productId)) {
            log.warn("Delete rejected: product {} is referenced by order items", productId);
            throw new ReferentialIntegrityException(
                    "Cannot delete product '" + product.getName() + "': it is referenced by orders");
        }

        int removedStocks = stockRepository.deleteByProductId(productId);
        productRepository.delete(product);
        log.info("Product deleted: id={}, sku={}, stockRowsRemoved={}", productId, product.getSku(), removedStocks);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockResponse> getProductStock(UUID productId) {
        // Verify product exists
        if (!productRepository.existsById(productId)) {
            throw new ResourceNotFoundException("Product not found");
        }

        return stockRepository.findByProductIdWithWarehouse(productId).stream()
                .map(stockMapper::toStockResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductResponse> getLowStockProducts(Integer threshold) {
        int effectiveThreshold = threshold != null ? threshold : properties.getStock().getLowStockThreshold();
        if (effectiveThreshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + effectiveThreshold);
        }

        List<Product> lowStock = productRepository.findActiveWithTotalStockBelow(effectiveThreshold);
        return productResponseAssembler.toResponses(lowStock);
    }
}
