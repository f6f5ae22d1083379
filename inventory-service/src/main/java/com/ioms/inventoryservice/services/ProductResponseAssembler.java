package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.mapper.ProductMapper;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.repository.OwnerTotal;
import com.ioms.inventoryservice.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds {@link ProductResponse}s together with each product's total stock.
 * Lists cost a single grouped query, never one per product.
 */
@Component
@RequiredArgsConstructor
public class ProductResponseAssembler {

    private final StockRepository stockRepository;
    private final ProductMapper productMapper;

    public ProductResponse toResponse(Product product) {
        Long totalStock = stockRepository.sumQtyByProductId(product.getId());
        return productMapper.toProductResponse(product, totalStock != null ? totalStock : 0L);
    }

    /**
     * For a subset of products: totals are grouped over their ids only.
     */
    public List<ProductResponse> toResponses(List<Product> products) {
        if (products.isEmpty()) {
            return List.of();
        }
        List<UUID> productIds = products.stream().map(Product::getId).toList();
        return withTotals(products, OwnerTotal.toMap(stockRepository.sumQtyPerProduct(productIds)));
    }

    /**
     * For a listing of every product: totals are grouped over the whole stock table.
     */
    public List<ProductResponse> toResponsesOfAll(List<Product> products) {
        if (products.isEmpty()) {
            return List.of();
        }
        return withTotals(products, OwnerTotal.toMap(stockRepository.sumQtyPerProduct()));
    }

    private List<ProductResponse> withTotals(List<Product> products, Map<UUID, Long> totals) {
        return products.stream()
                .map(product -> productMapper.toProductResponse(product, totals.getOrDefault(product.getId(), 0L)))
                .toList();
    }
}
